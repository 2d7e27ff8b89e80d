package com.cinegen.api.provider.veo;

import com.cinegen.api.operation.LongRunningOperationClient;
import com.cinegen.api.operation.OperationEndpoint;
import com.cinegen.api.operation.OperationResultDecoder;
import com.cinegen.api.provider.GenerationRequest;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderOutcome;
import com.cinegen.api.provider.ReferenceAsset;
import com.cinegen.api.storage.StorageService;
import com.cinegen.common.enums.QualityTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class VeoProviderAdapterTest {

    private MockRestServiceServer server;
    private LongRunningOperationClient operationClient;

    private final GenerationRequest request = GenerationRequest.builder()
            .jobId("job-1")
            .prompt("a calm lake at sunrise")
            .durationSeconds(8)
            .qualityTier(QualityTier.PREMIUM)
            .aspectRatio("16:9")
            .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        operationClient = new LongRunningOperationClient(restTemplate, new ObjectMapper(),
                new OperationResultDecoder(mock(StorageService.class)));
    }

    private VeoProviderAdapter gemini(boolean useReferenceImages) {
        return new VeoProviderAdapter(operationClient, "", "us-central1", "", "api-key", "veo-3.1-generate-preview",
                useReferenceImages, true);
    }

    private VeoProviderAdapter vertex() {
        return new VeoProviderAdapter(operationClient, "proj", "us-central1", "token", "", "veo-3.1-generate-preview",
                false, false);
    }

    @Test
    void availability_followsCredentials() {
        assertThat(gemini(false).isAvailable()).isTrue();
        assertThat(vertex().isAvailable()).isTrue();
        assertThat(new VeoProviderAdapter(operationClient, "proj", "us-central1", "", "", "m", false, true).isAvailable())
                .isFalse();
    }

    @Test
    void endpoint_vertexUsesFetchPredictOperation() {
        OperationEndpoint endpoint = vertex().endpoint();

        assertThat(endpoint.getSubmitUrl()).isEqualTo("https://us-central1-aiplatform.googleapis.com/v1/projects/proj"
                + "/locations/us-central1/publishers/google/models/veo-3.1-generate-preview:predictLongRunning");
        assertThat(endpoint.getPollUrl()).endsWith(":fetchPredictOperation");
        assertThat(endpoint.getPollStyle()).isEqualTo(OperationEndpoint.PollStyle.FETCH_PREDICT);
        assertThat(endpoint.getHeaders().getFirst("Authorization")).isEqualTo("Bearer token");
    }

    @Test
    void endpoint_geminiUsesOperationResource() {
        OperationEndpoint endpoint = gemini(false).endpoint();

        assertThat(endpoint.getPollStyle()).isEqualTo(OperationEndpoint.PollStyle.GET_RESOURCE);
        assertThat(endpoint.getHeaders().getFirst("x-goog-api-key")).isEqualTo("api-key");
    }

    @Test
    @SuppressWarnings("unchecked")
    void payload_carriesGenerationParameters() {
        Map<String, Object> payload = gemini(false).buildPayload(request);

        Map<String, Object> parameters = (Map<String, Object>) payload.get("parameters");
        assertThat(parameters)
                .containsEntry("aspectRatio", "16:9")
                .containsEntry("durationSeconds", "8")
                .containsEntry("sampleCount", 1)
                .containsEntry("personGeneration", "allow_all")
                .containsEntry("resolution", "1080p")
                .containsEntry("generateAudio", true)
                .containsEntry("includeRaiReason", true);
        Map<String, Object> instance = ((List<Map<String, Object>>) payload.get("instances")).get(0);
        assertThat(instance).containsEntry("prompt", "a calm lake at sunrise").doesNotContainKey("referenceImages");
    }

    @Test
    @SuppressWarnings("unchecked")
    void payload_referenceImagesOnlyWhenEnabledAndCappedAtThree() {
        GenerationRequest withReferences = request.toBuilder()
                .reference(ReferenceAsset.builder().bytes(new byte[]{1}).mimeType("image/png").role("persona").build())
                .reference(ReferenceAsset.builder().uri("gs://b/2.png").mimeType("image/png").build())
                .reference(ReferenceAsset.builder().bytes(new byte[]{3}).build())
                .reference(ReferenceAsset.builder().bytes(new byte[]{4}).build())
                .build();

        Map<String, Object> disabled = gemini(false).buildPayload(withReferences);
        assertThat(((List<Map<String, Object>>) disabled.get("instances")).get(0)).doesNotContainKey("referenceImages");

        Map<String, Object> enabled = gemini(true).buildPayload(withReferences);
        List<Map<String, Object>> images = (List<Map<String, Object>>)
                ((List<Map<String, Object>>) enabled.get("instances")).get(0).get("referenceImages");
        assertThat(images).hasSize(3);
        assertThat((Map<String, Object>) images.get(1).get("image")).containsEntry("gcsUri", "gs://b/2.png");
        assertThat(images.get(0)).containsEntry("referenceType", "asset");
    }

    @Test
    void submit_andPollThroughGeminiApi() {
        server.expect(requestTo("https://generativelanguage.googleapis.com/v1beta/models/veo-3.1-generate-preview:predictLongRunning"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "api-key"))
                .andExpect(jsonPath("$.instances[0].prompt").value("a calm lake at sunrise"))
                .andRespond(withSuccess("{\"name\":\"models/veo-3.1-generate-preview/operations/op1\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://generativelanguage.googleapis.com/v1beta/models/veo-3.1-generate-preview/operations/op1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"done\":true,\"response\":{\"generateVideoResponse\":"
                        + "{\"generatedSamples\":[{\"video\":{\"uri\":\"https://files/op1.mp4\"}}]}}}", MediaType.APPLICATION_JSON));

        VeoProviderAdapter adapter = gemini(false);
        ProviderOutcome outcome = adapter.submit(request);
        Operation operation = adapter.poll(outcome.getOperation().getHandle());

        assertThat(outcome.isPending()).isTrue();
        assertThat(operation.isDone()).isTrue();
        assertThat(operation.getOutput().getResultRef()).isEqualTo("https://files/op1.mp4");
        server.verify();
    }
}
