package com.cinegen.api.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 라우터 generate 결과
 */
@Getter
@Builder
public class RoutingResult {

    private final String providerUsed;
    private final boolean fallbackUsed;
    private final String selectionReason;
    private final ProviderOutcome outcome;
    @Singular
    private final List<Attempt> attempts;

    @Getter
    @Builder
    public static class Attempt {
        private final String provider;
        private final boolean success;
        private final String error;
    }
}
