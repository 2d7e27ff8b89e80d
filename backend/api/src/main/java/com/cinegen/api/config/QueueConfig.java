package com.cinegen.api.config;

import com.cinegen.api.queue.InMemoryJobQueue;
import com.cinegen.api.queue.JobQueue;
import com.cinegen.api.queue.RedisJobQueue;
import com.cinegen.api.store.JobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 작업 큐 선택 (cinegen.queue.type), 기동 시 한 번 결정되고 실행 중 바뀌지 않는다
 * - memory (기본): LinkedBlockingQueue
 * - redis: LPUSH / BRPOP
 */
@Slf4j
@Configuration
public class QueueConfig {

    @Bean
    public JobQueue jobQueue(@Value("${cinegen.queue.type:memory}") String type,
                             @Value("${cinegen.queue.redis-key:" + RedisJobQueue.DEFAULT_KEY + "}") String redisKey,
                             ObjectProvider<StringRedisTemplate> redisProvider,
                             ObjectMapper objectMapper,
                             JobStore jobStore) {
        if ("redis".equalsIgnoreCase(type)) {
            StringRedisTemplate redis = redisProvider.getIfAvailable();
            if (redis == null) {
                throw new IllegalStateException("cinegen.queue.type=redis but no Redis connection is configured");
            }
            log.info("[Queue] Using Redis queue - key: {}", redisKey);
            return new RedisJobQueue(redis, objectMapper, redisKey, jobStore);
        }
        if (!"memory".equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unknown cinegen.queue.type: " + type);
        }
        log.info("[Queue] Using in-memory queue");
        return new InMemoryJobQueue();
    }
}
