package com.cinegen.api.provider;

import com.cinegen.common.enums.QualityTier;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 프로바이더 공통 생성 요청
 * 작업 파라미터를 정규화한 값이며, 어댑터는 이 값만 보고 원격 요청을 만든다.
 */
@Getter
@Builder(toBuilder = true)
public class GenerationRequest {
    private final String jobId;
    private final String prompt;
    private final int durationSeconds;
    private final QualityTier qualityTier;
    private final String aspectRatio;
    @Singular
    private final List<ReferenceAsset> references;
    @Singular
    private final List<String> personaIds;

    /**
     * 결과 파일 저장 경로 힌트
     */
    public String suggestedOutputName(String provider, String extension) {
        String base = jobId != null ? jobId : String.valueOf(System.currentTimeMillis());
        return "videos/" + provider + "/" + base + "." + extension;
    }
}
