package com.cinegen.api.operation;

import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderOutcome;
import com.cinegen.api.storage.StorageService;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LongRunningOperationClientTest {

    private static final String MODEL_URL = "https://us-central1-aiplatform.googleapis.com/v1/projects/p1/locations/us-central1/publishers/google/models/veo";
    private static final String QUALIFIED = "projects/p1/locations/us-central1/publishers/google/models/veo/operations/abc123";

    private MockRestServiceServer server;
    private StorageService storageService;
    private LongRunningOperationClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        storageService = mock(StorageService.class);
        client = new LongRunningOperationClient(restTemplate, new ObjectMapper(), new OperationResultDecoder(storageService));
    }

    private OperationEndpoint vertex() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("token");
        return OperationEndpoint.builder()
                .provider("veo")
                .submitUrl(MODEL_URL + ":predictLongRunning")
                .pollUrl(MODEL_URL + ":fetchPredictOperation")
                .pollStyle(OperationEndpoint.PollStyle.FETCH_PREDICT)
                .headers(headers)
                .build();
    }

    private OperationEndpoint gemini() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-goog-api-key", "key");
        return OperationEndpoint.builder()
                .provider("veo")
                .submitUrl("https://gen.example/v1beta/models/veo:predictLongRunning")
                .pollUrl("https://gen.example/v1beta")
                .pollStyle(OperationEndpoint.PollStyle.GET_RESOURCE)
                .headers(headers)
                .build();
    }

    @Test
    void submit_operationNameGivesPendingOutcome() {
        server.expect(requestTo(MODEL_URL + ":predictLongRunning"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token"))
                .andRespond(withSuccess("{\"name\":\"" + QUALIFIED + "\"}", MediaType.APPLICATION_JSON));

        ProviderOutcome outcome = client.submit(vertex(), Map.of("instances", "x"), "videos/veo/job.mp4");

        assertThat(outcome.isPending()).isTrue();
        assertThat(outcome.getOperation().getHandle()).isEqualTo(QUALIFIED);
        assertThat(outcome.getOperation().getShortHandle()).isEqualTo("abc123");
        assertThat(outcome.getOperation().isDone()).isFalse();
        server.verify();
    }

    @Test
    void submit_immediatePredictionsAreDecoded() {
        when(storageService.put(any(), eq("videos/veo/job.mp4"), eq("video/mp4"))).thenReturn("/data/videos/veo/job.mp4");
        server.expect(requestTo(MODEL_URL + ":predictLongRunning"))
                .andRespond(withSuccess("{\"predictions\":[{\"bytesBase64Encoded\":\"AAECAw==\",\"mimeType\":\"video/mp4\"}]}",
                        MediaType.APPLICATION_JSON));

        ProviderOutcome outcome = client.submit(vertex(), Map.of(), "videos/veo/job.mp4");

        assertThat(outcome.isPending()).isFalse();
        assertThat(outcome.getOutput().getResultRef()).isEqualTo("/data/videos/veo/job.mp4");
        assertThat(outcome.getOutput().getSource()).isEqualTo(GenerationOutput.Source.INLINE_STORED);
    }

    @Test
    void submit_unrecognisedResponseIsDecodeError() {
        server.expect(requestTo(MODEL_URL + ":predictLongRunning"))
                .andRespond(withSuccess("{\"foo\":1}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.submit(vertex(), Map.of(), "x.mp4"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.DECODE_ERROR);
    }

    @Test
    void submit_httpErrorIsGenerationFailure() {
        server.expect(requestTo(MODEL_URL + ":predictLongRunning"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"error\":{\"message\":\"bad prompt\"}}"));

        assertThatThrownBy(() -> client.submit(vertex(), Map.of(), "x.mp4"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("HTTP 400")
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.PROVIDER_GENERATION_FAILED);
    }

    @Test
    void poll_retriesWithShortFormAfter404() {
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation"))
                .andExpect(content().json("{\"operationName\":\"" + QUALIFIED + "\"}"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation"))
                .andExpect(content().json("{\"operationName\":\"abc123\"}"))
                .andRespond(withSuccess("{\"name\":\"abc123\",\"done\":true,"
                        + "\"response\":{\"videos\":[{\"gcsUri\":\"gs://bucket/out.mp4\",\"mimeType\":\"video/mp4\"}]}}",
                        MediaType.APPLICATION_JSON));

        Operation operation = client.poll(vertex(), OperationHandle.of(QUALIFIED), "x.mp4");

        assertThat(operation.isDone()).isTrue();
        assertThat(operation.isFailed()).isFalse();
        assertThat(operation.getOutput().getResultRef()).isEqualTo("gs://bucket/out.mp4");
        assertThat(operation.getOutput().getSource()).isEqualTo(GenerationOutput.Source.REMOTE_URI);
        assertThat(operation.getHandle()).isEqualTo(QUALIFIED);
        server.verify();
    }

    @Test
    void poll_bodyNotFoundStatusAlsoTriggersShortForm() {
        server.expect(requestTo("https://gen.example/v1beta/models/veo/operations/xyz"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("x-goog-api-key", "key"))
                .andRespond(withSuccess("{\"error\":{\"code\":404,\"status\":\"NOT_FOUND\"}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://gen.example/v1beta/xyz"))
                .andRespond(withSuccess("{\"name\":\"xyz\",\"done\":false,\"metadata\":{\"progressPercent\":40}}",
                        MediaType.APPLICATION_JSON));

        Operation operation = client.poll(gemini(), OperationHandle.of("models/veo/operations/xyz"), "x.mp4");

        assertThat(operation.isDone()).isFalse();
        assertThat(operation.reportedProgress()).isEqualTo(40);
        server.verify();
    }

    @Test
    void poll_bothFormsMissingIsOperationNotFound() {
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.poll(vertex(), OperationHandle.of(QUALIFIED), "x.mp4"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.OPERATION_NOT_FOUND);
        server.verify();
    }

    @Test
    void poll_bareHandleIsNotRetried() {
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.poll(vertex(), OperationHandle.of("abc123"), "x.mp4"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.OPERATION_NOT_FOUND);
        server.verify();
    }

    @Test
    void poll_operationErrorIsReportedAsFailedOperation() {
        server.expect(requestTo(MODEL_URL + ":fetchPredictOperation"))
                .andRespond(withSuccess("{\"done\":true,\"error\":{\"code\":3,\"message\":\"prompt rejected\"}}",
                        MediaType.APPLICATION_JSON));

        Operation operation = client.poll(vertex(), OperationHandle.of(QUALIFIED), "x.mp4");

        assertThat(operation.isFailed()).isTrue();
        assertThat(operation.getErrorCode()).isEqualTo(ErrorCode.PROVIDER_GENERATION_FAILED);
        assertThat(operation.getError()).contains("prompt rejected");
        assertThat(operation.getOutput()).isNull();
    }
}
