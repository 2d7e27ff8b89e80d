package com.cinegen.api.operation;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.regex.Pattern;

/**
 * 원격 작업 핸들
 * qualified: projects/{p}/locations/{l}/publishers/google/models/{m}/operations/{id}
 * short: {id}
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationHandle {

    /** URL 경로에 그대로 붙으므로 영숫자와 _ . / - 만 허용 */
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_./-]+");

    private final String qualified;
    private final String shortForm;

    public static OperationHandle of(String name) {
        if (name == null || name.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Operation handle is empty");
        }
        String trimmed = name.trim();
        if (!ALLOWED.matcher(trimmed).matches() || trimmed.contains("..") || trimmed.startsWith("/")) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Invalid operation handle: " + trimmed);
        }
        int idx = trimmed.lastIndexOf('/');
        String shortForm = idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
        return new OperationHandle(trimmed, shortForm);
    }

    /**
     * 짧은 형식으로 다시 시도할 의미가 있는지
     */
    public boolean hasDistinctShortForm() {
        return !shortForm.isEmpty() && !shortForm.equals(qualified);
    }

    @Override
    public String toString() {
        return qualified;
    }
}
