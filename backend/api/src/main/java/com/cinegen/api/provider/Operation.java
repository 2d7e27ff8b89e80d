package com.cinegen.api.provider;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 원격 장기 실행 작업의 한 시점 스냅샷
 * done 이면 output 과 error 중 정확히 하나가 채워진다.
 */
@Getter
@Builder(toBuilder = true)
public class Operation {
    private final String handle;        // 정규화된 전체 이름 (projects/.../operations/{id})
    private final String shortHandle;   // {id}
    private final boolean done;
    private final GenerationOutput output;
    private final ErrorCode errorCode;
    private final String error;
    private final Map<String, Object> metadata;

    public static Operation pending(String handle, String shortHandle, Map<String, Object> metadata) {
        return Operation.builder()
                .handle(handle)
                .shortHandle(shortHandle)
                .done(false)
                .metadata(metadata != null ? metadata : Collections.emptyMap())
                .build();
    }

    public boolean isFailed() {
        return done && error != null;
    }

    /**
     * 프로바이더가 보고한 진행률 (0~100), 없으면 null
     */
    public Integer reportedProgress() {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.getOrDefault("progressPercent", metadata.get("progress"));
        if (value instanceof Number) {
            return Math.max(0, Math.min(100, ((Number) value).intValue()));
        }
        return null;
    }

    /**
     * 실패한 작업을 예외로 변환
     */
    public ApiException toException() {
        ErrorCode code = errorCode != null ? errorCode : ErrorCode.PROVIDER_GENERATION_FAILED;
        return new ApiException(code, error != null ? error : code.getMessage());
    }
}
