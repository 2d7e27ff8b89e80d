package com.cinegen.api.queue;

import com.cinegen.common.enums.JobKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 큐에 올라가는 작업 디스크립터
 * 작업 본문은 JobStore 에 있고, 큐에는 식별자만 흐른다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJob {
    private String jobId;
    private JobKind kind;
    private Instant enqueuedAt;
}
