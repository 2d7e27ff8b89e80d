package com.cinegen.api.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * 생성 작업 FIFO 큐
 *
 * 구현체(memory / redis)는 애플리케이션 시작 시 한 번 선택되며 실행 중 바뀌지 않는다.
 */
public interface JobQueue {

    /**
     * 작업을 큐에 추가하고 즉시 반환한다.
     * 저장에 실패하면 QUEUE_UNAVAILABLE ApiException 을 던진다. (조용히 버리지 않음)
     *
     * @return 큐에 들어간 작업 ID
     */
    String enqueue(QueuedJob job);

    /**
     * 다음 작업을 꺼낸다. 최대 waitTimeout 동안 대기하고, 없으면 empty.
     * 하나의 작업은 정확히 한 호출자에게만 전달된다.
     */
    Optional<QueuedJob> dequeue(Duration waitTimeout);

    long size();

    String type();
}
