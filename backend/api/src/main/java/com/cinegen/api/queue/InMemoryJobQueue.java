package com.cinegen.api.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 프로세스 로컬 큐
 * 재시작 시 대기 작업은 사라지며 여러 프로세스 간 공유되지 않는다.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<QueuedJob> queue = new LinkedBlockingQueue<>();

    @Override
    public String enqueue(QueuedJob job) {
        queue.add(job);
        log.debug("[Queue] Added job {} to memory queue (size: {})", job.getJobId(), queue.size());
        return job.getJobId();
    }

    @Override
    public Optional<QueuedJob> dequeue(Duration waitTimeout) {
        try {
            return Optional.ofNullable(queue.poll(waitTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public long size() {
        return queue.size();
    }

    @Override
    public String type() {
        return "memory";
    }
}
