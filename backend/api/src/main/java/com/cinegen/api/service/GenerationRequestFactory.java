package com.cinegen.api.service;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.api.persona.PersonaReferenceResolver;
import com.cinegen.api.provider.GenerationRequest;
import com.cinegen.api.provider.ReferenceAsset;
import com.cinegen.common.enums.QualityTier;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 작업 레코드 → 프로바이더 공통 GenerationRequest 변환
 *
 * 파라미터 해석 규칙:
 * - durationSeconds (별칭 duration): 1~60 정수, 기본 8
 * - aspectRatio: 16:9 | 9:16, 기본 16:9
 * - quality: standard | premium (별칭 sd, hd ...), 기본 standard
 */
@Slf4j
@Component
public class GenerationRequestFactory {

    public static final int DEFAULT_DURATION_SECONDS = 8;
    public static final String DEFAULT_ASPECT_RATIO = "16:9";
    public static final int MAX_REFERENCES = 3;

    private static final Set<String> ASPECT_RATIOS = Set.of("16:9", "9:16");
    private static final int MAX_DURATION_SECONDS = 60;

    private final PersonaReferenceResolver personaReferenceResolver;

    // 페르소나 참조 자산 캐시 (TTL 1시간)
    private final Cache<String, List<ReferenceAsset>> referenceCache = Caffeine.newBuilder()
            .expireAfterWrite(1, TimeUnit.HOURS)
            .maximumSize(200)
            .build();

    public GenerationRequestFactory(PersonaReferenceResolver personaReferenceResolver) {
        this.personaReferenceResolver = personaReferenceResolver;
    }

    public GenerationRequest build(GenerationJob job) {
        Map<String, Object> parameters = job.getParameters() != null ? job.getParameters() : Collections.emptyMap();
        List<String> personaIds = job.getPersonaIds() != null ? job.getPersonaIds() : Collections.emptyList();

        return GenerationRequest.builder()
                .jobId(job.getJobId())
                .prompt(job.getPrompt())
                .durationSeconds(durationOf(parameters))
                .qualityTier(qualityOf(parameters))
                .aspectRatio(aspectRatioOf(parameters))
                .references(resolveReferences(job.getPrompt(), personaIds))
                .personaIds(personaIds)
                .build();
    }

    public int durationOf(Map<String, Object> parameters) {
        Object raw = parameters.containsKey("durationSeconds") ? parameters.get("durationSeconds") : parameters.get("duration");
        if (raw == null || String.valueOf(raw).isBlank()) {
            return DEFAULT_DURATION_SECONDS;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "durationSeconds must be an integer: " + raw);
        }
        if (value.stripTrailingZeros().scale() > 0) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "durationSeconds must be an integer: " + raw);
        }
        // 범위 확인 후에만 int 로 좁힌다
        if (value.compareTo(BigDecimal.ONE) < 0 || value.compareTo(BigDecimal.valueOf(MAX_DURATION_SECONDS)) > 0) {
            throw new ApiException(ErrorCode.INVALID_REQUEST,
                    "durationSeconds must be between 1 and " + MAX_DURATION_SECONDS + ": " + raw);
        }
        int duration = value.intValueExact();
        return duration;
    }

    public String aspectRatioOf(Map<String, Object> parameters) {
        Object raw = parameters.get("aspectRatio");
        if (raw == null || String.valueOf(raw).isBlank()) {
            return DEFAULT_ASPECT_RATIO;
        }
        String aspectRatio = String.valueOf(raw).trim();
        if (!ASPECT_RATIOS.contains(aspectRatio)) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Unsupported aspectRatio: " + aspectRatio);
        }
        return aspectRatio;
    }

    public QualityTier qualityOf(Map<String, Object> parameters) {
        Object raw = parameters.get("quality");
        if (raw == null || String.valueOf(raw).isBlank()) {
            return QualityTier.STANDARD;
        }
        return QualityTier.fromHint(String.valueOf(raw))
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_REQUEST, "Unknown quality: " + raw));
    }

    private List<ReferenceAsset> resolveReferences(String prompt, List<String> personaIds) {
        String key = String.join(",", personaIds) + "|" + prompt;
        List<ReferenceAsset> cached = referenceCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        List<ReferenceAsset> references;
        try {
            List<ReferenceAsset> resolved = personaReferenceResolver.resolveReferences(prompt, personaIds);
            references = resolved == null ? Collections.emptyList()
                    : List.copyOf(resolved.subList(0, Math.min(MAX_REFERENCES, resolved.size())));
        } catch (RuntimeException e) {
            // 참조 자산 없이도 생성은 가능하므로 프롬프트만으로 진행
            log.warn("[Request] Persona reference resolution failed, continuing without references: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
        referenceCache.put(key, references);
        log.debug("[Request] Resolved {} reference(s) for personas {}", references.size(), personaIds);
        return references;
    }
}
