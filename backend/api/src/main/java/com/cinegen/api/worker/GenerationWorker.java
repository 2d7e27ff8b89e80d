package com.cinegen.api.worker;

import com.cinegen.api.dto.WorkerDto;
import com.cinegen.api.entity.GenerationJob;
import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.provider.GenerationRequest;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderRouter;
import com.cinegen.api.provider.RoutingResult;
import com.cinegen.api.queue.JobQueue;
import com.cinegen.api.queue.QueuedJob;
import com.cinegen.api.service.GenerationRequestFactory;
import com.cinegen.api.store.JobStore;
import com.cinegen.common.enums.JobStatus;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 생성 작업 워커
 *
 * 프로세스당 하나의 스레드가 큐를 비운다. 작업은 순차 처리된다.
 * 모든 상태 기록은 저장소의 compare-and-transition 을 거치므로,
 * 처리 도중 취소된 작업에 대한 완료/실패 기록은 거부되고 로그만 남는다.
 *
 * 진행률: 10 시작 → 30 프로바이더 제출 → 30~85 작업 대기 → 90 마무리 → 100 완료
 */
@Slf4j
@Component
public class GenerationWorker {

    static final int PROGRESS_STARTED = 10;
    static final int PROGRESS_SUBMITTED = 30;
    static final int PROGRESS_POLLING_MAX = 85;
    static final int PROGRESS_FINALIZING = 90;

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final ProviderRouter providerRouter;
    private final GenerationRequestFactory requestFactory;

    private final boolean enabled;
    private final String workerId;
    private final Duration pollTimeout;
    private final Duration idleBackoff;
    private final Duration errorBackoff;
    private final Duration operationPollInterval;
    private final Duration operationTimeout;

    private volatile boolean running;
    private volatile String currentJobId;
    private Thread thread;
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public GenerationWorker(JobStore jobStore,
                            JobQueue jobQueue,
                            ProviderRouter providerRouter,
                            GenerationRequestFactory requestFactory,
                            @Value("${cinegen.worker.enabled:true}") boolean enabled,
                            @Value("${cinegen.worker.id:}") String workerId,
                            @Value("${cinegen.worker.poll-timeout:5s}") Duration pollTimeout,
                            @Value("${cinegen.worker.idle-backoff:1s}") Duration idleBackoff,
                            @Value("${cinegen.worker.error-backoff:5s}") Duration errorBackoff,
                            @Value("${cinegen.worker.operation-poll-interval:10s}") Duration operationPollInterval,
                            @Value("${cinegen.worker.operation-timeout:10m}") Duration operationTimeout) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.providerRouter = providerRouter;
        this.requestFactory = requestFactory;
        this.enabled = enabled;
        this.workerId = workerId == null || workerId.isBlank()
                ? "worker-" + UUID.randomUUID().toString().substring(0, 8)
                : workerId;
        this.pollTimeout = pollTimeout;
        this.idleBackoff = idleBackoff;
        this.errorBackoff = errorBackoff;
        this.operationPollInterval = operationPollInterval;
        this.operationTimeout = operationTimeout;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("[Worker] Disabled (cinegen.worker.enabled=false) - workerId: {}", workerId);
            return;
        }
        running = true;
        thread = new Thread(this::runLoop, "generation-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("[Worker] Started - workerId: {}, queue: {}, pollInterval: {}, timeout: {}",
                workerId, jobQueue.type(), operationPollInterval, operationTimeout);
    }

    @PreDestroy
    public void stop() {
        if (thread == null) {
            return;
        }
        running = false;
        thread.interrupt();
        try {
            thread.join(Duration.ofSeconds(10).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Worker] Stopped - workerId: {}, processed: {}, failed: {}",
                workerId, processedCount.get(), failedCount.get());
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            if (!runOnce()) {
                break;
            }
        }
    }

    /**
     * 큐에서 작업 하나를 꺼내 처리
     * @return 루프를 계속할지 여부 (인터럽트되면 false)
     */
    boolean runOnce() {
        try {
            Optional<QueuedJob> next = jobQueue.dequeue(pollTimeout);
            if (next.isEmpty()) {
                return sleep(idleBackoff);
            }
            processJob(next.get().getJobId());
            return !Thread.currentThread().isInterrupted();
        } catch (RuntimeException e) {
            log.error("[Worker] Queue loop error, backing off {}: {}", errorBackoff, e.getMessage(), e);
            return sleep(errorBackoff);
        }
    }

    /**
     * 작업 하나를 끝까지 처리 (클레임 → 생성 → 대기 → 종료 기록)
     * QUEUED 가 아닌 작업은 건드리지 않는다.
     */
    public void processJob(String jobId) {
        Optional<GenerationJob> record = jobStore.findById(jobId);
        if (record.isEmpty()) {
            log.warn("[Worker] Job {} not found in store, skipping", jobId);
            return;
        }
        if (record.get().getStatus() != JobStatus.QUEUED) {
            log.info("[Worker] Job {} is {}, skipping", jobId, record.get().getStatus());
            return;
        }
        if (!jobStore.claim(jobId, workerId)) {
            log.info("[Worker] Job {} could not be claimed (cancelled or taken), skipping", jobId);
            return;
        }

        currentJobId = jobId;
        try {
            GenerationJob job = jobStore.findById(jobId)
                    .orElseThrow(() -> new ApiException(ErrorCode.JOB_NOT_FOUND, "Job disappeared after claim: " + jobId));
            generate(job);
        } catch (ApiException e) {
            failJob(jobId, e.toJobErrorMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failJob(jobId, ErrorCode.INTERNAL_SERVER_ERROR.name() + ": Worker stopped while waiting for the operation");
        } catch (RuntimeException e) {
            log.error("[Worker] Unexpected error on job {}", jobId, e);
            failJob(jobId, ErrorCode.INTERNAL_SERVER_ERROR.name() + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            currentJobId = null;
        }
    }

    private void generate(GenerationJob job) throws InterruptedException {
        String jobId = job.getJobId();
        progress(jobId, PROGRESS_STARTED, "Starting generation");

        GenerationRequest request = requestFactory.build(job);
        String explicitProvider = job.parameter("provider");
        log.info("[Worker] Generating job {} - provider: {}, tier: {}, duration: {}s",
                jobId, explicitProvider != null ? explicitProvider : "auto",
                request.getQualityTier(), request.getDurationSeconds());

        RoutingResult routing = providerRouter.generate(request, explicitProvider);
        String provider = routing.getProviderUsed();
        progress(jobId, PROGRESS_SUBMITTED, "Submitting to " + provider);

        GenerationOutput output;
        String operationHandle = null;
        if (routing.getOutcome().isPending()) {
            Operation operation = awaitOperation(jobId, provider, routing.getOutcome().getOperation());
            if (operation == null) {
                return;
            }
            operationHandle = operation.getHandle();
            output = operation.getOutput();
        } else {
            output = routing.getOutcome().getOutput();
        }

        if (!progress(jobId, PROGRESS_FINALIZING, "Finalizing")) {
            log.info("[Worker] Job {} left PROCESSING before finalizing, result discarded", jobId);
            return;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (output.getMetadata() != null) {
            metadata.putAll(output.getMetadata());
        }
        metadata.put("providerUsed", provider);
        metadata.put("fallbackUsed", routing.isFallbackUsed());
        metadata.put("selectionReason", routing.getSelectionReason());
        if (operationHandle != null) {
            metadata.put("operationHandle", operationHandle);
        }
        metadata.put("source", output.getSource() != null ? output.getSource().name() : null);
        metadata.put("mimeType", output.getMimeType());

        if (jobStore.complete(jobId, workerId, output.getResultRef(), metadata)) {
            processedCount.incrementAndGet();
            log.info("[Worker] Job {} completed - provider: {}, fallback: {}, result: {}",
                    jobId, provider, routing.isFallbackUsed(), output.getResultRef());
        } else {
            log.info("[Worker] Completion of job {} rejected (no longer PROCESSING)", jobId);
        }
    }

    /**
     * 작업 완료까지 폴링. 취소가 관찰되면 null.
     */
    private Operation awaitOperation(String jobId, String provider, Operation pending) throws InterruptedException {
        Instant start = Instant.now();
        Instant deadline = start.plus(operationTimeout);
        Operation current = pending;
        int lastProgress = PROGRESS_SUBMITTED;

        log.info("[Worker] Waiting for {} operation {} (job {})", provider, current.getHandle(), jobId);
        while (!current.isDone()) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new ApiException(ErrorCode.OPERATION_TIMEOUT,
                        provider + " operation " + current.getHandle() + " did not finish within " + operationTimeout);
            }
            Thread.sleep(Math.min(operationPollInterval.toMillis(), remaining.toMillis()));

            if (!isStillProcessing(jobId)) {
                log.info("[Worker] Job {} is no longer PROCESSING, stop waiting for {}", jobId, current.getHandle());
                return null;
            }

            current = providerRouter.poll(provider, current.getHandle());

            int progress = Math.max(lastProgress, pollingProgress(current, start));
            if (progress > lastProgress) {
                lastProgress = progress;
                progress(jobId, progress, "Waiting for " + provider + " (" + progress + "%)");
            }
        }

        if (current.isFailed()) {
            throw current.toException();
        }
        log.info("[Worker] {} operation {} finished in {}s", provider, current.getHandle(),
                Duration.between(start, Instant.now()).toSeconds());
        return current;
    }

    /**
     * 프로바이더 진행률이 있으면 30~85 로 환산, 없으면 경과 시간 비율
     */
    private int pollingProgress(Operation operation, Instant start) {
        int span = PROGRESS_POLLING_MAX - PROGRESS_SUBMITTED;
        Integer reported = operation.reportedProgress();
        if (reported != null) {
            return PROGRESS_SUBMITTED + reported * span / 100;
        }
        long elapsed = Duration.between(start, Instant.now()).toMillis();
        long total = Math.max(1, operationTimeout.toMillis());
        return (int) Math.min(PROGRESS_POLLING_MAX, PROGRESS_SUBMITTED + elapsed * span / total);
    }

    private boolean isStillProcessing(String jobId) {
        return jobStore.findById(jobId)
                .map(j -> j.getStatus() == JobStatus.PROCESSING)
                .orElse(false);
    }

    private boolean progress(String jobId, int progress, String step) {
        boolean applied = jobStore.updateProgress(jobId, workerId, progress, step);
        if (!applied) {
            log.debug("[Worker] Progress {} for job {} not applied", progress, jobId);
        }
        return applied;
    }

    private void failJob(String jobId, String errorMessage) {
        if (jobStore.fail(jobId, workerId, errorMessage)) {
            failedCount.incrementAndGet();
            log.warn("[Worker] Job {} failed - {}", jobId, errorMessage);
        } else {
            log.info("[Worker] Failure of job {} not recorded (no longer PROCESSING): {}", jobId, errorMessage);
        }
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public WorkerDto.ResStatus getStatus() {
        return WorkerDto.ResStatus.builder()
                .workerId(workerId)
                .running(running && thread != null && thread.isAlive())
                .queueType(jobQueue.type())
                .queueSize(jobQueue.size())
                .currentJobId(currentJobId)
                .processedCount(processedCount.get())
                .failedCount(failedCount.get())
                .build();
    }

    public String getWorkerId() {
        return workerId;
    }
}
