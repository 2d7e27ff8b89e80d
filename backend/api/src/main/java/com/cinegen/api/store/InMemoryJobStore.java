package com.cinegen.api.store;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.common.enums.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * 프로세스 로컬 작업 저장소
 * ConcurrentHashMap.computeIfPresent 로 레코드 단위 원자적 전이를 보장한다.
 * 레코드는 불변 객체이며 전이 시 toBuilder 로 교체된다.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void create(GenerationJob job) {
        GenerationJob previous = jobs.putIfAbsent(job.getJobId(), job);
        if (previous != null) {
            throw new IllegalStateException("Duplicate job id: " + job.getJobId());
        }
    }

    @Override
    public Optional<GenerationJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<GenerationJob> findRecent(JobStatus status, int limit) {
        return jobs.values().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .sorted(Comparator.comparing(GenerationJob::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public void delete(String jobId) {
        jobs.remove(jobId);
    }

    @Override
    public boolean claim(String jobId, String workerId) {
        return transition(jobId, Set.of(JobStatus.QUEUED), null, job -> job.toBuilder()
                .status(JobStatus.PROCESSING)
                .ownerWorkerId(workerId)
                .progress(0)
                .currentStep("Claimed by worker")
                .updatedAt(LocalDateTime.now())
                .build());
    }

    @Override
    public boolean updateProgress(String jobId, String workerId, int progress, String currentStep) {
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (id, job) -> {
            if (job.getStatus() != JobStatus.PROCESSING
                    || !Objects.equals(job.getOwnerWorkerId(), workerId)
                    || progress < job.progressOrZero()) {
                return job;
            }
            applied.set(true);
            return job.toBuilder()
                    .progress(Math.min(progress, 100))
                    .currentStep(currentStep)
                    .updatedAt(LocalDateTime.now())
                    .build();
        });
        return applied.get();
    }

    @Override
    public boolean complete(String jobId, String workerId, String resultRef, Map<String, Object> resultMetadata) {
        return transition(jobId, Set.of(JobStatus.PROCESSING), workerId, job -> {
            LocalDateTime now = LocalDateTime.now();
            return job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(100)
                    .currentStep("Generation completed")
                    .resultRef(resultRef)
                    .resultMetadata(resultMetadata)
                    .errorMessage(null)
                    .updatedAt(now)
                    .completedAt(now)
                    .build();
        });
    }

    @Override
    public boolean fail(String jobId, String workerId, String errorMessage) {
        return transition(jobId, JobStatus.ACTIVE, workerId, job -> {
            LocalDateTime now = LocalDateTime.now();
            return job.toBuilder()
                    .status(JobStatus.FAILED)
                    .currentStep("Generation failed")
                    .resultRef(null)
                    .errorMessage(errorMessage)
                    .updatedAt(now)
                    .completedAt(now)
                    .build();
        });
    }

    @Override
    public boolean cancel(String jobId) {
        return transition(jobId, JobStatus.ACTIVE, null, job -> {
            LocalDateTime now = LocalDateTime.now();
            return job.toBuilder()
                    .status(JobStatus.CANCELLED)
                    .currentStep("Cancelled")
                    .updatedAt(now)
                    .completedAt(now)
                    .build();
        });
    }

    private boolean transition(String jobId, Set<JobStatus> expected, String workerId,
                               UnaryOperator<GenerationJob> mutation) {
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (id, job) -> {
            if (!expected.contains(job.getStatus())) {
                return job;
            }
            if (workerId != null && job.getOwnerWorkerId() != null
                    && !workerId.equals(job.getOwnerWorkerId())) {
                return job;
            }
            applied.set(true);
            return mutation.apply(job);
        });
        if (!applied.get()) {
            log.debug("[JobStore] Transition rejected - jobId: {}, expected: {}", jobId, expected);
        }
        return applied.get();
    }
}
