package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import lombok.Getter;

/**
 * 청크 렌더 실패
 * retryable 이면 호출자가 작업을 render_queued 로 되돌린다 (완료된 청크는 유지).
 */
@Getter
public class RenderFailedException extends JobException {

    private final int chunkIndex;
    private final boolean retryable;

    public RenderFailedException(ErrorCode errorCode, int chunkIndex, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause);
        this.chunkIndex = chunkIndex;
        this.retryable = retryable;
    }

    public static RenderFailedException retryable(ErrorCode errorCode, int chunkIndex, String message, Throwable cause) {
        return new RenderFailedException(errorCode, chunkIndex, message, cause, true);
    }

    public static RenderFailedException fatal(ErrorCode errorCode, int chunkIndex, String message, Throwable cause) {
        return new RenderFailedException(errorCode, chunkIndex, message, cause, false);
    }
}
