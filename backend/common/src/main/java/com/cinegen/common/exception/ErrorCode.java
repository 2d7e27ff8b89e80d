package com.cinegen.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),

    // Job
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "J001", "작업을 찾을 수 없습니다."),
    ALREADY_TERMINAL(HttpStatus.CONFLICT, "J002", "이미 종료된 작업입니다."),
    QUEUE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "J003", "작업 큐에 연결할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // Provider
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "P001", "요청한 영상 생성 서비스를 사용할 수 없습니다."),
    ALL_PROVIDERS_FAILED(HttpStatus.BAD_GATEWAY, "P002", "모든 영상 생성 서비스가 실패했습니다."),
    PROVIDER_GENERATION_FAILED(HttpStatus.BAD_GATEWAY, "P003", "영상 생성에 실패했습니다."),

    // Long-running operation
    OPERATION_NOT_FOUND(HttpStatus.NOT_FOUND, "O001", "작업 핸들을 찾을 수 없습니다."),
    OPERATION_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "O002", "영상 생성 시간이 초과되었습니다."),
    DECODE_ERROR(HttpStatus.BAD_GATEWAY, "O003", "영상 생성 결과를 해석할 수 없습니다."),

    // Storage
    STORAGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S001", "파일 저장에 실패했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
