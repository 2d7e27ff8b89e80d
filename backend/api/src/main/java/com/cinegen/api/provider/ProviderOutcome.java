package com.cinegen.api.provider;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 어댑터 submit 결과: 즉시 완료된 출력 또는 폴링해야 할 작업
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderOutcome {

    private final GenerationOutput output;
    private final Operation operation;

    public static ProviderOutcome completed(GenerationOutput output) {
        return new ProviderOutcome(output, null);
    }

    public static ProviderOutcome pending(Operation operation) {
        return new ProviderOutcome(null, operation);
    }

    public boolean isPending() {
        return operation != null;
    }
}
