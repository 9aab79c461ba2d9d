package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;

import java.util.List;

/**
 * 렌더 실행기 요청 한도 초과 (재시도 대상)
 */
public class RenderRateLimitedException extends JobException {

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate exceeded",
            "rate limit",
            "concurrency limit",
            "toomanyrequestsexception",
            "concurrentinvocationlimitexceeded"
    );

    public RenderRateLimitedException(String message, Throwable cause) {
        super(ErrorCode.RENDER_RATE_LIMITED, message, cause);
    }

    public static boolean isRateLimitMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return RATE_LIMIT_MARKERS.stream().anyMatch(lower::contains);
    }
}
