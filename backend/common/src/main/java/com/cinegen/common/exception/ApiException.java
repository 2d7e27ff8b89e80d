package com.cinegen.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외
 * ErrorCode로 분류되며, 메시지가 없으면 ErrorCode 기본 메시지를 사용한다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public ApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 작업 실패 기록용 문자열 ("ERROR_CODE: 상세 메시지")
     */
    public String toJobErrorMessage() {
        return errorCode.name() + ": " + getMessage();
    }
}
