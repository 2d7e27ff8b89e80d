package com.cinegen.api.dto;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.common.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public class JobDto {

    /**
     * 생성 작업 제출 요청
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReqSubmit {
        private String kind;                    // "video" (기본)
        private List<String> personaIds;
        private String prompt;
        private Map<String, Object> parameters; // provider, quality, durationSeconds, aspectRatio
    }

    /**
     * 생성 작업 제출 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResSubmit {
        private String jobId;
        private JobStatus status;
        private String message;
    }

    /**
     * 작업 상태 조회 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResStatus {
        private String jobId;
        private String kind;
        private String prompt;
        private JobStatus status;
        private int progress;                        // 0-100
        private String currentStep;
        private String resultRef;                    // COMPLETED 일 때만
        private String errorMessage;                 // FAILED 일 때만
        private Map<String, Object> resultMetadata;  // providerUsed, fallbackUsed, selectionReason ...
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
        private LocalDateTime completedAt;

        public static ResStatus from(GenerationJob job) {
            return ResStatus.builder()
                    .jobId(job.getJobId())
                    .kind(job.getKind() != null ? job.getKind().getCode() : null)
                    .prompt(job.getPrompt())
                    .status(job.getStatus())
                    .progress(job.progressOrZero())
                    .currentStep(job.getCurrentStep())
                    .resultRef(job.getResultRef())
                    .errorMessage(job.getErrorMessage())
                    .resultMetadata(job.getResultMetadata())
                    .createdAt(job.getCreatedAt())
                    .updatedAt(job.getUpdatedAt())
                    .completedAt(job.getCompletedAt())
                    .build();
        }
    }

    /**
     * 작업 취소 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResCancel {
        private String jobId;
        private JobStatus status;
    }

    /**
     * 요청 사전 검증 응답 (큐에 넣지 않음)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResValidate {
        private boolean valid;
        private List<String> issues;
        private List<String> warnings;
        private List<String> suggestions;
        private Integer durationSeconds;
        private String aspectRatio;
        private String quality;
        private String selectedProvider;          // 현재 환경에서 선택될 프로바이더 (없으면 null)
        private Map<String, Boolean> providers;   // 프로바이더별 사용 가능 여부
    }
}
