package com.cinegen.api.queue;

import com.cinegen.api.store.JobStore;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis 리스트 기반 큐
 * - enqueue: LPUSH
 * - dequeue: BRPOP (원자적, 여러 워커 프로세스 사이에서 중복 전달 없음)
 * 해석할 수 없는 항목은 jobId 를 찾을 수 있으면 해당 작업을 FAILED 로 기록한다.
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    public static final String DEFAULT_KEY = "cinegen:generation_queue";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String queueKey;
    private final JobStore jobStore;

    public RedisJobQueue(StringRedisTemplate redis, ObjectMapper objectMapper, String queueKey, JobStore jobStore) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.queueKey = queueKey;
        this.jobStore = jobStore;
    }

    @Override
    public String enqueue(QueuedJob job) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "Failed to serialize queued job " + job.getJobId(), e);
        }

        try {
            redis.opsForList().leftPush(queueKey, payload);
        } catch (DataAccessException e) {
            log.error("[Queue] Redis enqueue failed - jobId: {}, error: {}", job.getJobId(), e.getMessage());
            throw new ApiException(ErrorCode.QUEUE_UNAVAILABLE,
                    "Redis queue unavailable: " + e.getMessage(), e);
        }
        log.debug("[Queue] Added job {} to Redis queue {}", job.getJobId(), queueKey);
        return job.getJobId();
    }

    @Override
    public Optional<QueuedJob> dequeue(Duration waitTimeout) {
        String payload;
        try {
            payload = redis.opsForList().rightPop(queueKey, waitTimeout);
        } catch (DataAccessException e) {
            throw new ApiException(ErrorCode.QUEUE_UNAVAILABLE,
                    "Redis queue unavailable: " + e.getMessage(), e);
        }
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload, QueuedJob.class));
        } catch (JsonProcessingException e) {
            log.error("[Queue] Unreadable queue entry: {}", payload, e);
            failUnreadable(payload, e);
            return Optional.empty();
        }
    }

    /**
     * 꺼낸 시점에 이미 큐에서 빠졌으므로, 레코드가 QUEUED 로 남지 않도록 실패 처리
     */
    private void failUnreadable(String payload, JsonProcessingException cause) {
        String jobId = null;
        try {
            JsonNode node = objectMapper.readTree(payload);
            jobId = node.path("jobId").asText(null);
        } catch (JsonProcessingException e) {
            log.warn("[Queue] No jobId recoverable from unreadable entry: {}", e.getOriginalMessage());
        }
        if (jobId == null || jobId.isBlank()) {
            return;
        }
        String message = ErrorCode.DECODE_ERROR.name() + ": Unreadable queue entry: " + cause.getOriginalMessage();
        if (jobStore.fail(jobId, null, message)) {
            log.warn("[Queue] Job {} marked FAILED (unreadable queue entry)", jobId);
        } else {
            log.info("[Queue] Job {} from unreadable entry is no longer active, left as is", jobId);
        }
    }

    @Override
    public long size() {
        try {
            Long size = redis.opsForList().size(queueKey);
            return size != null ? size : 0L;
        } catch (DataAccessException e) {
            log.warn("[Queue] Redis size query failed: {}", e.getMessage());
            return -1L;
        }
    }

    @Override
    public String type() {
        return "redis";
    }
}
