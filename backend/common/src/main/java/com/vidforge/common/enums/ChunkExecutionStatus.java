package com.vidforge.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 원격 렌더 실행기가 보고하는 청크 상태
 */
@Getter
@RequiredArgsConstructor
public enum ChunkExecutionStatus {

    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    FAILED("failed"),
    NOT_FOUND("not_found");

    @JsonValue
    private final String code;

    public boolean isResolved() {
        return this != IN_PROGRESS;
    }
}
