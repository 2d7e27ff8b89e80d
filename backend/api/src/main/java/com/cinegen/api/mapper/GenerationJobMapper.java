package com.cinegen.api.mapper;

import com.cinegen.api.entity.GenerationJob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * generation_job 테이블 매퍼
 *
 * 상태 전이 쿼리는 모두 WHERE status IN (...) 조건부 UPDATE 이며,
 * 반환값(갱신된 행 수)이 0이면 전이가 거부된 것이다. (레이스 컨디션 방지)
 */
@Mapper
public interface GenerationJobMapper {

    void insert(GenerationJob job);

    Optional<GenerationJob> findById(String jobId);

    List<GenerationJob> findRecent(@Param("status") String status, @Param("limit") int limit);

    void delete(String jobId);

    int claim(@Param("jobId") String jobId, @Param("workerId") String workerId);

    int updateProgress(@Param("jobId") String jobId,
                       @Param("workerId") String workerId,
                       @Param("progress") int progress,
                       @Param("currentStep") String currentStep);

    int complete(@Param("jobId") String jobId,
                 @Param("workerId") String workerId,
                 @Param("resultRef") String resultRef,
                 @Param("resultMetadata") Map<String, Object> resultMetadata);

    int fail(@Param("jobId") String jobId,
             @Param("workerId") String workerId,
             @Param("errorMessage") String errorMessage);

    int cancel(String jobId);
}
