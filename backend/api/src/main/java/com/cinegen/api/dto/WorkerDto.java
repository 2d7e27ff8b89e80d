package com.cinegen.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

public class WorkerDto {

    /**
     * 워커 상태
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResStatus {
        private String workerId;
        private boolean running;
        private String queueType;
        private long queueSize;          // Redis 조회 실패 시 -1
        private String currentJobId;
        private long processedCount;
        private long failedCount;
    }
}
