package com.cinegen.api.entity;

import com.cinegen.common.enums.JobKind;
import com.cinegen.common.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationJob {
    private String jobId;
    private JobKind kind;
    private List<String> personaIds;
    private String prompt;
    private Map<String, Object> parameters;    // provider, quality, durationSeconds, aspectRatio ...
    private JobStatus status;
    private Integer progress;
    private String currentStep;
    private String resultRef;                  // COMPLETED 일 때만
    private Map<String, Object> resultMetadata; // providerUsed, fallbackUsed, operationHandle ...
    private String errorMessage;               // FAILED 일 때만 ("ERROR_CODE: detail")
    private String ownerWorkerId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    public int progressOrZero() {
        return progress != null ? progress : 0;
    }

    public String parameter(String key) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
