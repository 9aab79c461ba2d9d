package com.vidforge.common.exception;

import lombok.Getter;

/**
 * 작업 처리 중 발생하는 비즈니스 예외
 * 워커는 이 예외를 잡아서 작업 상태(error)와 메시지로 기록한다.
 */
@Getter
public class JobException extends RuntimeException {

    private final ErrorCode errorCode;

    public JobException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public JobException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JobException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 작업 레코드에 남길 문자열 (코드 + 메시지)
     */
    public String toJobMessage() {
        return "[" + errorCode.getCode() + "] " + getMessage();
    }
}
