package com.cinegen.api.store;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.common.enums.JobStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 생성 작업 레코드 저장소
 *
 * 모든 상태 변경은 compare-and-transition 으로 수행된다.
 * 기대 상태가 아니면 아무것도 바꾸지 않고 false 를 반환하므로,
 * 이미 CANCELLED 된 작업에 대한 워커의 COMPLETED/FAILED 기록은 저장소가 거부한다.
 */
public interface JobStore {

    void create(GenerationJob job);

    Optional<GenerationJob> findById(String jobId);

    /**
     * 최근 작업 목록 (최신순)
     * @param status null 이면 전체
     */
    List<GenerationJob> findRecent(JobStatus status, int limit);

    /**
     * 큐 등록 실패 시 레코드 롤백용
     */
    void delete(String jobId);

    /**
     * QUEUED → PROCESSING, 소유 워커 기록
     */
    boolean claim(String jobId, String workerId);

    /**
     * PROCESSING 상태이고 소유 워커가 일치하며 progress 가 감소하지 않는 경우에만 반영
     */
    boolean updateProgress(String jobId, String workerId, int progress, String currentStep);

    /**
     * PROCESSING → COMPLETED (progress 100)
     */
    boolean complete(String jobId, String workerId, String resultRef, Map<String, Object> resultMetadata);

    /**
     * QUEUED | PROCESSING → FAILED
     * @param workerId null 이면 소유자 검사 생략 (큐 등록 전 실패 등)
     */
    boolean fail(String jobId, String workerId, String errorMessage);

    /**
     * QUEUED | PROCESSING → CANCELLED
     */
    boolean cancel(String jobId);
}
