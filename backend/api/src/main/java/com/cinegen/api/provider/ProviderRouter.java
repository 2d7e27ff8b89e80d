package com.cinegen.api.provider;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 프로바이더 선택 및 폴백 라우터
 *
 * 선택 순서: 명시 요청(사용 가능할 때) → 기본 프로바이더 → 우선순위 목록의 첫 사용 가능 프로바이더.
 * 같은 환경(자격 증명 집합)에서는 항상 같은 결과를 낸다.
 */
@Slf4j
@Component
public class ProviderRouter {

    private final Map<String, VideoProviderAdapter> adapters;   // 우선순위 순서
    private final String defaultProvider;
    private final boolean strictExplicit;

    public ProviderRouter(List<VideoProviderAdapter> adapterList,
                          @Value("${cinegen.router.priority:veo,sora}") String priority,
                          @Value("${cinegen.router.default-provider:}") String defaultProvider,
                          @Value("${cinegen.router.strict-explicit:true}") boolean strictExplicit) {
        this.adapters = orderByPriority(adapterList, priority);
        this.defaultProvider = normalize(defaultProvider);
        this.strictExplicit = strictExplicit;
        log.info("[Router] Providers in priority order: {}, default: {}, strictExplicit: {}",
                adapters.keySet(), this.defaultProvider, strictExplicit);
    }

    /**
     * 사용할 프로바이더 이름 선택
     * @param explicitProvider 사용자가 지정한 프로바이더 (nullable)
     */
    public String select(String explicitProvider) {
        return choose(normalize(explicitProvider)).name;
    }

    /**
     * 선택된 프로바이더로 생성 요청, 자동 선택 모드에서는 실패 시 다음 프로바이더로 폴백
     */
    public RoutingResult generate(GenerationRequest request, String explicitProvider) {
        String explicit = normalize(explicitProvider);

        if (explicit != null) {
            VideoProviderAdapter adapter = adapters.get(explicit);
            boolean usable = adapter != null && adapter.isAvailable();
            if (usable) {
                return generateExplicit(adapter, request);
            }
            if (strictExplicit) {
                throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE,
                        adapter == null
                                ? "Unknown provider: " + explicit
                                : "Requested provider is not available: " + explicit);
            }
            log.warn("[Router] Requested provider '{}' unavailable, falling back to automatic selection", explicit);
        }

        Choice choice = choose(explicit);
        List<String> candidates = new ArrayList<>();
        candidates.add(choice.name);
        adapters.values().stream()
                .filter(VideoProviderAdapter::isAvailable)
                .map(VideoProviderAdapter::getName)
                .filter(name -> !name.equals(choice.name))
                .forEach(candidates::add);

        String firstChoice = firstChoice();
        RoutingResult.RoutingResultBuilder result = RoutingResult.builder();
        List<String> failures = new ArrayList<>();

        for (String name : candidates) {
            VideoProviderAdapter adapter = adapters.get(name);
            try {
                log.info("[Router] Trying provider: {}", name);
                ProviderOutcome outcome = adapter.submit(request);
                result.attempt(RoutingResult.Attempt.builder().provider(name).success(true).build());

                String reason = name.equals(choice.name)
                        ? choice.reason
                        : "fallback after failure of " + String.join(", ", failedNames(failures));
                boolean fallbackUsed = !name.equals(firstChoice);
                log.info("[Router] Provider {} accepted request (fallbackUsed: {}, reason: {})", name, fallbackUsed, reason);
                return result.providerUsed(name)
                        .fallbackUsed(fallbackUsed)
                        .selectionReason(reason)
                        .outcome(outcome)
                        .build();
            } catch (RuntimeException e) {
                String message = describe(e);
                log.warn("[Router] Provider {} failed: {}", name, message);
                result.attempt(RoutingResult.Attempt.builder().provider(name).success(false).error(message).build());
                failures.add(name + ": " + message);
            }
        }

        throw new ApiException(ErrorCode.ALL_PROVIDERS_FAILED,
                "All providers failed - " + String.join("; ", failures));
    }

    /**
     * 특정 프로바이더의 작업 상태 조회 (1회)
     */
    public Operation poll(String providerName, String handle) {
        String name = normalize(providerName);
        VideoProviderAdapter adapter = name != null ? adapters.get(name) : null;
        if (adapter == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Unknown provider: " + providerName);
        }
        if (!adapter.isAvailable()) {
            throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE, "Provider is not available: " + name);
        }
        return adapter.poll(handle);
    }

    public List<ProviderDescriptor> listProviders() {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        int priority = 1;
        for (VideoProviderAdapter adapter : adapters.values()) {
            descriptors.add(ProviderDescriptor.builder()
                    .name(adapter.getName())
                    .modelId(adapter.getModelId())
                    .available(adapter.isAvailable())
                    .priority(priority++)
                    .isDefault(adapter.getName().equals(firstChoice()))
                    .build());
        }
        return descriptors;
    }

    public boolean isKnown(String providerName) {
        String name = normalize(providerName);
        return name != null && adapters.containsKey(name);
    }

    private RoutingResult generateExplicit(VideoProviderAdapter adapter, GenerationRequest request) {
        log.info("[Router] Using explicitly requested provider: {}", adapter.getName());
        // 명시 요청 실패는 폴백 없이 그대로 전파
        ProviderOutcome outcome = adapter.submit(request);
        return RoutingResult.builder()
                .providerUsed(adapter.getName())
                .fallbackUsed(false)
                .selectionReason("explicit request")
                .outcome(outcome)
                .attempt(RoutingResult.Attempt.builder().provider(adapter.getName()).success(true).build())
                .build();
    }

    private Choice choose(String explicit) {
        String overridden = "";
        if (explicit != null) {
            VideoProviderAdapter adapter = adapters.get(explicit);
            if (adapter != null && adapter.isAvailable()) {
                return new Choice(explicit, "explicit request");
            }
            overridden = "explicit request overridden (" + explicit + " unavailable), ";
        }

        if (defaultProvider != null) {
            VideoProviderAdapter adapter = adapters.get(defaultProvider);
            if (adapter != null && adapter.isAvailable()) {
                return new Choice(defaultProvider, overridden + "default provider");
            }
        }

        for (VideoProviderAdapter adapter : adapters.values()) {
            if (adapter.isAvailable()) {
                return new Choice(adapter.getName(), overridden + "first available in priority order");
            }
        }

        throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE,
                "No video provider is available (configured: " + adapters.keySet() + ")");
    }

    /**
     * 폴백 여부 판단 기준: 기본 프로바이더, 없으면 우선순위 목록의 첫 항목
     */
    private String firstChoice() {
        if (defaultProvider != null && adapters.containsKey(defaultProvider)) {
            return defaultProvider;
        }
        return adapters.isEmpty() ? null : adapters.keySet().iterator().next();
    }

    private static List<String> failedNames(List<String> failures) {
        return failures.stream()
                .map(f -> f.substring(0, f.indexOf(':')))
                .collect(Collectors.toList());
    }

    private static String describe(RuntimeException e) {
        if (e instanceof ApiException) {
            return ((ApiException) e).toJobErrorMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static Map<String, VideoProviderAdapter> orderByPriority(List<VideoProviderAdapter> adapterList, String priority) {
        Map<String, VideoProviderAdapter> byName = new LinkedHashMap<>();
        adapterList.forEach(a -> byName.put(a.getName(), a));

        Map<String, VideoProviderAdapter> ordered = new LinkedHashMap<>();
        Arrays.stream(priority.split(","))
                .map(ProviderRouter::normalize)
                .filter(name -> name != null && byName.containsKey(name))
                .forEach(name -> ordered.put(name, byName.get(name)));
        // 우선순위 목록에 없는 어댑터는 등록 순서대로 뒤에 붙인다
        byName.forEach(ordered::putIfAbsent);
        return ordered;
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank() || "auto".equalsIgnoreCase(name.trim())) {
            return null;
        }
        return name.trim().toLowerCase();
    }

    private static class Choice {
        private final String name;
        private final String reason;

        private Choice(String name, String reason) {
            this.name = name;
            this.reason = reason;
        }
    }
}
