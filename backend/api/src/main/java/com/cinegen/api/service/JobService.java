package com.cinegen.api.service;

import com.cinegen.api.dto.JobDto;
import com.cinegen.api.dto.ProviderDto;
import com.cinegen.api.entity.GenerationJob;
import com.cinegen.api.provider.ProviderDescriptor;
import com.cinegen.api.provider.ProviderRouter;
import com.cinegen.api.queue.JobQueue;
import com.cinegen.api.queue.QueuedJob;
import com.cinegen.api.store.JobStore;
import com.cinegen.common.enums.JobKind;
import com.cinegen.common.enums.JobStatus;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 생성 작업 제출 / 조회 / 취소
 *
 * 제출은 저장소 기록과 큐 등록을 하나의 단위로 취급한다.
 * 큐 등록이 실패하면 레코드를 지우고 예외를 그대로 던진다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    public static final int MIN_PROMPT_LENGTH = 10;
    public static final int LONG_PROMPT_LENGTH = 500;
    private static final int DEFAULT_LIST_LIMIT = 20;
    private static final int MAX_LIST_LIMIT = 100;

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final ProviderRouter providerRouter;
    private final GenerationRequestFactory requestFactory;

    public JobDto.ResSubmit submit(JobDto.ReqSubmit request) {
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "prompt is required");
        }
        JobKind kind = kindOf(request.getKind());
        Map<String, Object> parameters = request.getParameters() != null
                ? new HashMap<>(request.getParameters())
                : new HashMap<>();
        validateParameters(parameters);

        LocalDateTime now = LocalDateTime.now();
        GenerationJob job = GenerationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .kind(kind)
                .personaIds(request.getPersonaIds() != null ? List.copyOf(request.getPersonaIds()) : Collections.emptyList())
                .prompt(request.getPrompt().trim())
                .parameters(parameters)
                .status(JobStatus.QUEUED)
                .progress(0)
                .currentStep("Queued")
                .createdAt(now)
                .updatedAt(now)
                .build();

        jobStore.create(job);
        try {
            jobQueue.enqueue(QueuedJob.builder()
                    .jobId(job.getJobId())
                    .kind(kind)
                    .enqueuedAt(Instant.now())
                    .build());
        } catch (RuntimeException e) {
            // 큐에 들어가지 못한 작업은 기록도 남기지 않는다
            jobStore.delete(job.getJobId());
            log.error("[Job] Enqueue failed, record removed - jobId: {}, error: {}", job.getJobId(), e.getMessage());
            if (e instanceof ApiException) {
                throw e;
            }
            throw new ApiException(ErrorCode.QUEUE_UNAVAILABLE, "Failed to enqueue job: " + e.getMessage(), e);
        }

        log.info("[Job] Submitted - jobId: {}, kind: {}, provider: {}, queue: {}",
                job.getJobId(), kind, job.parameter("provider"), jobQueue.type());
        return JobDto.ResSubmit.builder()
                .jobId(job.getJobId())
                .status(JobStatus.QUEUED)
                .message("영상 생성 작업이 등록되었습니다.")
                .build();
    }

    public JobDto.ResStatus getStatus(String jobId) {
        return JobDto.ResStatus.from(findJob(jobId));
    }

    /**
     * QUEUED | PROCESSING → CANCELLED, 이미 종료된 작업이면 ALREADY_TERMINAL
     */
    public JobDto.ResCancel cancel(String jobId) {
        GenerationJob job = findJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new ApiException(ErrorCode.ALREADY_TERMINAL, "Job " + jobId + " is already " + job.getStatus());
        }
        if (!jobStore.cancel(jobId)) {
            GenerationJob current = jobStore.findById(jobId).orElse(job);
            throw new ApiException(ErrorCode.ALREADY_TERMINAL,
                    "Job " + jobId + " is already " + current.getStatus());
        }
        log.info("[Job] Cancelled - jobId: {} (was {})", jobId, job.getStatus());
        return JobDto.ResCancel.builder()
                .jobId(jobId)
                .status(JobStatus.CANCELLED)
                .build();
    }

    public List<JobDto.ResStatus> list(String status, Integer limit) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = JobStatus.valueOf(status.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new ApiException(ErrorCode.INVALID_REQUEST, "Unknown status: " + status);
            }
        }
        int effectiveLimit = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return jobStore.findRecent(filter, effectiveLimit).stream()
                .map(JobDto.ResStatus::from)
                .collect(Collectors.toList());
    }

    /**
     * 큐에 넣지 않고 요청만 검증
     */
    public JobDto.ResValidate validate(JobDto.ReqSubmit request) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        String prompt = request != null && request.getPrompt() != null ? request.getPrompt().trim() : "";
        if (prompt.isEmpty()) {
            issues.add("prompt is required");
        } else if (prompt.length() < MIN_PROMPT_LENGTH) {
            issues.add("Prompt too short (minimum " + MIN_PROMPT_LENGTH + " characters)");
        } else if (prompt.length() > LONG_PROMPT_LENGTH) {
            warnings.add("Prompt quite long - consider shortening for better results");
        }
        String lower = prompt.toLowerCase();
        if (!prompt.isEmpty() && !lower.contains("high quality")) {
            suggestions.add("Consider adding 'high quality' for better results");
        }
        if (!prompt.isEmpty() && !(lower.contains("cinematic") || lower.contains("professional") || lower.contains("detailed"))) {
            suggestions.add("Adding descriptive terms like 'cinematic' can improve quality");
        }

        if (request != null && request.getKind() != null && JobKind.fromCode(request.getKind()).isEmpty()) {
            issues.add("Unknown kind: " + request.getKind());
        }

        Map<String, Object> parameters = request != null && request.getParameters() != null
                ? request.getParameters()
                : Collections.emptyMap();
        JobDto.ResValidate.ResValidateBuilder result = JobDto.ResValidate.builder();
        try {
            result.durationSeconds(requestFactory.durationOf(parameters));
        } catch (ApiException e) {
            issues.add(e.getMessage());
        }
        try {
            result.aspectRatio(requestFactory.aspectRatioOf(parameters));
        } catch (ApiException e) {
            issues.add(e.getMessage());
        }
        try {
            result.quality(requestFactory.qualityOf(parameters).getCode());
        } catch (ApiException e) {
            issues.add(e.getMessage());
        }

        Map<String, Boolean> providers = new LinkedHashMap<>();
        providerRouter.listProviders().forEach(p -> providers.put(p.getName(), p.isAvailable()));

        Object explicit = parameters.get("provider");
        String explicitProvider = explicit != null ? String.valueOf(explicit) : null;
        if (explicitProvider != null && !explicitProvider.isBlank() && !"auto".equalsIgnoreCase(explicitProvider.trim())) {
            if (!providerRouter.isKnown(explicitProvider)) {
                issues.add("Unknown provider: " + explicitProvider);
            } else if (!providers.getOrDefault(explicitProvider.trim().toLowerCase(), false)) {
                issues.add("Requested provider is not available: " + explicitProvider);
            }
        }

        try {
            result.selectedProvider(providerRouter.select(explicitProvider));
        } catch (ApiException e) {
            issues.add(e.getMessage());
        }

        return result.valid(issues.isEmpty())
                .issues(issues)
                .warnings(warnings)
                .suggestions(suggestions)
                .providers(providers)
                .build();
    }

    public List<ProviderDto.ResProvider> listProviders() {
        List<ProviderDescriptor> descriptors = providerRouter.listProviders();
        return descriptors.stream()
                .map(ProviderDto.ResProvider::from)
                .collect(Collectors.toList());
    }

    public ProviderDto.ResOperation pollOperation(String provider, String handle) {
        if (handle == null || handle.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "handle is required");
        }
        return ProviderDto.ResOperation.from(provider, providerRouter.poll(provider, handle));
    }

    private GenerationJob findJob(String jobId) {
        return jobStore.findById(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.JOB_NOT_FOUND, "Job not found: " + jobId));
    }

    private JobKind kindOf(String kind) {
        if (kind == null || kind.isBlank()) {
            return JobKind.VIDEO;
        }
        return JobKind.fromCode(kind)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_REQUEST, "Unknown kind: " + kind));
    }

    private void validateParameters(Map<String, Object> parameters) {
        requestFactory.durationOf(parameters);
        requestFactory.aspectRatioOf(parameters);
        requestFactory.qualityOf(parameters);

        Object provider = parameters.get("provider");
        if (provider != null) {
            String name = String.valueOf(provider).trim();
            if (!name.isEmpty() && !"auto".equalsIgnoreCase(name) && !providerRouter.isKnown(name)) {
                throw new ApiException(ErrorCode.INVALID_REQUEST, "Unknown provider: " + name);
            }
        }
    }
}
