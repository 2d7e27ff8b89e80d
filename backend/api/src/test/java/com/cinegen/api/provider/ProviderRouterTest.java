package com.cinegen.api.provider;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRouterTest {

    private final GenerationRequest request = GenerationRequest.builder()
            .jobId("job-1")
            .prompt("a calm lake at sunrise")
            .durationSeconds(8)
            .aspectRatio("16:9")
            .build();

    private ProviderRouter router(String defaultProvider, boolean strict, VideoProviderAdapter... adapters) {
        return new ProviderRouter(List.of(adapters), "veo,sora", defaultProvider, strict);
    }

    @Test
    void select_isDeterministicForFixedEnvironment() {
        ProviderRouter router = router("", true,
                new FakeProviderAdapter("sora", true), new FakeProviderAdapter("veo", true));

        assertThat(router.select(null)).isEqualTo("veo");
        assertThat(router.select(null)).isEqualTo("veo");
        assertThat(router.select("auto")).isEqualTo("veo");
        assertThat(router.select("sora")).isEqualTo("sora");
    }

    @Test
    void select_prefersDefaultProviderWhenAvailable() {
        ProviderRouter router = router("sora", true,
                new FakeProviderAdapter("veo", true), new FakeProviderAdapter("sora", true));

        assertThat(router.select(null)).isEqualTo("sora");
    }

    @Test
    void select_skipsUnavailableProviders() {
        ProviderRouter router = router("veo", true,
                new FakeProviderAdapter("veo", false), new FakeProviderAdapter("sora", true));

        assertThat(router.select(null)).isEqualTo("sora");
        assertThat(router.select("veo")).isEqualTo("sora");
    }

    @Test
    void select_noProviderAvailable() {
        ProviderRouter router = router("", true,
                new FakeProviderAdapter("veo", false), new FakeProviderAdapter("sora", false));

        assertThatThrownBy(() -> router.select(null))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.PROVIDER_UNAVAILABLE);
    }

    @Test
    void generate_automaticFallbackReportsFallbackUsed() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true)
                .failsWith(new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "quota exceeded"));
        FakeProviderAdapter sora = new FakeProviderAdapter("sora", true).completesWith("s3://bucket/b.mp4");
        ProviderRouter router = router("", true, veo, sora);

        RoutingResult result = router.generate(request, null);

        assertThat(result.getProviderUsed()).isEqualTo("sora");
        assertThat(result.isFallbackUsed()).isTrue();
        assertThat(result.getSelectionReason()).contains("veo");
        assertThat(result.getOutcome().getOutput().getResultRef()).isEqualTo("s3://bucket/b.mp4");
        assertThat(result.getAttempts()).extracting(RoutingResult.Attempt::getProvider).containsExactly("veo", "sora");
        assertThat(result.getAttempts().get(0).isSuccess()).isFalse();
    }

    @Test
    void generate_firstChoiceSuccessIsNotFallback() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true).completesWith("gs://a.mp4");
        ProviderRouter router = router("", true, veo, new FakeProviderAdapter("sora", true));

        RoutingResult result = router.generate(request, null);

        assertThat(result.getProviderUsed()).isEqualTo("veo");
        assertThat(result.isFallbackUsed()).isFalse();
    }

    @Test
    void generate_unavailableFirstChoiceCountsAsFallback() {
        FakeProviderAdapter sora = new FakeProviderAdapter("sora", true).completesWith("s3://b.mp4");
        ProviderRouter router = router("", true, new FakeProviderAdapter("veo", false), sora);

        RoutingResult result = router.generate(request, null);

        assertThat(result.getProviderUsed()).isEqualTo("sora");
        assertThat(result.isFallbackUsed()).isTrue();
    }

    @Test
    void generate_explicitUnavailableFailsWithoutFallback() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true).completesWith("gs://a.mp4");
        ProviderRouter router = router("", true, veo, new FakeProviderAdapter("sora", false));

        assertThatThrownBy(() -> router.generate(request, "sora"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.PROVIDER_UNAVAILABLE);
        assertThat(veo.getSubmitted()).isEmpty();
    }

    @Test
    void generate_explicitFailurePropagates() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true).completesWith("gs://a.mp4");
        FakeProviderAdapter sora = new FakeProviderAdapter("sora", true)
                .failsWith(new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "HTTP 500"));
        ProviderRouter router = router("", true, veo, sora);

        assertThatThrownBy(() -> router.generate(request, "sora"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("HTTP 500");
        assertThat(veo.getSubmitted()).isEmpty();
    }

    @Test
    void generate_nonStrictOverridesUnavailableExplicit() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true).completesWith("gs://a.mp4");
        ProviderRouter router = router("", false, veo, new FakeProviderAdapter("sora", false));

        RoutingResult result = router.generate(request, "sora");

        assertThat(result.getProviderUsed()).isEqualTo("veo");
        assertThat(result.getSelectionReason()).contains("explicit request overridden");
    }

    @Test
    void generate_allProvidersFailEnumeratesEveryError() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true)
                .failsWith(new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "veo quota exceeded"));
        FakeProviderAdapter sora = new FakeProviderAdapter("sora", true)
                .failsWith(new IllegalStateException("sora connection reset"));
        ProviderRouter router = router("", true, veo, sora);

        assertThatThrownBy(() -> router.generate(request, null))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("veo: PROVIDER_GENERATION_FAILED: veo quota exceeded")
                .hasMessageContaining("sora: IllegalStateException: sora connection reset")
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.ALL_PROVIDERS_FAILED);
    }

    @Test
    void generate_tryEachProviderOnlyOnce() {
        FakeProviderAdapter veo = new FakeProviderAdapter("veo", true)
                .failsWith(new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "a"));
        FakeProviderAdapter sora = new FakeProviderAdapter("sora", true)
                .failsWith(new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "b"));
        ProviderRouter router = router("", true, veo, sora);

        assertThatThrownBy(() -> router.generate(request, null)).isInstanceOf(ApiException.class);
        assertThat(veo.getSubmitted()).hasSize(1);
        assertThat(sora.getSubmitted()).hasSize(1);
    }

    @Test
    void poll_unknownProviderIsInvalidRequest() {
        ProviderRouter router = router("", true, new FakeProviderAdapter("veo", true));

        assertThatThrownBy(() -> router.poll("runway", "operations/1"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    @Test
    void listProviders_reportsPriorityAndDefault() {
        ProviderRouter router = router("", true,
                new FakeProviderAdapter("sora", true), new FakeProviderAdapter("veo", false));

        List<ProviderDescriptor> providers = router.listProviders();

        assertThat(providers).extracting(ProviderDescriptor::getName).containsExactly("veo", "sora");
        assertThat(providers.get(0).getPriority()).isEqualTo(1);
        assertThat(providers.get(0).isDefault()).isTrue();
        assertThat(providers.get(0).isAvailable()).isFalse();
        assertThat(providers.get(1).getModelId()).isEqualTo("sora-model");
    }
}
