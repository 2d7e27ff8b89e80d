package com.cinegen.api.config;

import com.cinegen.common.dto.ApiResponse;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.UUID;

/**
 * 전역 예외 처리기
 * - ApiException 은 ErrorCode 의 HTTP 상태로 응답
 * - 모든 응답 메시지에 요청 ID 를 붙여 로그와 대조할 수 있게 한다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] {} ({}) - {} at {}", requestId, errorCode.name(), errorCode.getCode(),
                    e.getMessage(), request.getDescription(false), e);
        } else {
            log.warn("[{}] {} ({}) - {} at {}", requestId, errorCode.name(), errorCode.getCode(),
                    e.getMessage(), request.getDescription(false));
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * 요청 본문/파라미터 형식 오류
     */
    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Bad request at {}: {}", requestId, request.getDescription(false), e.getMessage());

        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST,
                        buildUserMessage(ErrorCode.INVALID_REQUEST, null, requestId)));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Unexpected Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Exception Type: {}", e.getClass().getName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("============================");

        String userMessage = String.format(
            "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
            requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }
}
