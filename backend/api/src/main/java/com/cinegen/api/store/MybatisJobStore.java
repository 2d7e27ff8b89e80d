package com.cinegen.api.store;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.api.mapper.GenerationJobMapper;
import com.cinegen.common.enums.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MySQL(generation_job 테이블) 기반 작업 저장소
 * 여러 워커 프로세스가 같은 레코드를 공유할 때 사용한다.
 */
@Slf4j
@RequiredArgsConstructor
public class MybatisJobStore implements JobStore {

    private final GenerationJobMapper generationJobMapper;

    @Override
    public void create(GenerationJob job) {
        generationJobMapper.insert(job);
    }

    @Override
    public Optional<GenerationJob> findById(String jobId) {
        return generationJobMapper.findById(jobId);
    }

    @Override
    public List<GenerationJob> findRecent(JobStatus status, int limit) {
        return generationJobMapper.findRecent(status != null ? status.name() : null, Math.max(0, limit));
    }

    @Override
    public void delete(String jobId) {
        generationJobMapper.delete(jobId);
    }

    @Override
    public boolean claim(String jobId, String workerId) {
        return applied("claim", jobId, generationJobMapper.claim(jobId, workerId));
    }

    @Override
    public boolean updateProgress(String jobId, String workerId, int progress, String currentStep) {
        return generationJobMapper.updateProgress(jobId, workerId, Math.min(progress, 100), currentStep) > 0;
    }

    @Override
    public boolean complete(String jobId, String workerId, String resultRef, Map<String, Object> resultMetadata) {
        return applied("complete", jobId, generationJobMapper.complete(jobId, workerId, resultRef, resultMetadata));
    }

    @Override
    public boolean fail(String jobId, String workerId, String errorMessage) {
        return applied("fail", jobId, generationJobMapper.fail(jobId, workerId, errorMessage));
    }

    @Override
    public boolean cancel(String jobId) {
        return applied("cancel", jobId, generationJobMapper.cancel(jobId));
    }

    private boolean applied(String transition, String jobId, int updatedRows) {
        if (updatedRows == 0) {
            log.debug("[JobStore] {} rejected - jobId: {}", transition, jobId);
            return false;
        }
        return true;
    }
}
