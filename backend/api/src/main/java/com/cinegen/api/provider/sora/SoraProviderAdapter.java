package com.cinegen.api.provider.sora;

import com.cinegen.api.operation.OperationHandle;
import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.provider.GenerationRequest;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderOutcome;
import com.cinegen.api.provider.VideoProviderAdapter;
import com.cinegen.api.storage.StorageService;
import com.cinegen.common.enums.QualityTier;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI Sora 어댑터 (Videos API)
 *
 * POST /videos → 작업 id (항상 비동기)
 * GET  /videos/{id} → status: queued | in_progress | completed | failed
 * GET  /videos/{id}/content → mp4 바이너리, 저장소에 저장
 */
@Slf4j
@Component
public class SoraProviderAdapter implements VideoProviderAdapter {

    public static final String NAME = "sora";

    private static final int[] ALLOWED_SECONDS = {4, 8, 12};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final StorageService storageService;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public SoraProviderAdapter(RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               StorageService storageService,
                               @Value("${cinegen.providers.sora.api-key:}") String apiKey,
                               @Value("${cinegen.providers.sora.base-url:https://api.openai.com/v1}") String baseUrl,
                               @Value("${cinegen.providers.sora.model:sora-2}") String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.storageService = storageService;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        log.info("[Sora] Adapter initialized - model: {}, available: {}", model, isAvailable());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getModelId() {
        return model;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ProviderOutcome submit(GenerationRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", request.getPrompt());
        payload.put("seconds", String.valueOf(toAllowedSeconds(request.getDurationSeconds())));
        payload.put("size", toSize(request.getQualityTier(), request.getAspectRatio()));

        log.info("[Sora] Creating video - model: {}, seconds: {}, size: {}",
                model, payload.get("seconds"), payload.get("size"));

        JsonNode body = call(baseUrl + "/videos", HttpMethod.POST, payload, "create");
        String videoId = body.path("id").asText(null);
        if (videoId == null || videoId.isBlank()) {
            throw new ApiException(ErrorCode.DECODE_ERROR, "Sora response has no video id");
        }
        log.info("[Sora] Video job created: {}", videoId);
        return ProviderOutcome.pending(Operation.pending(videoId, videoId, progressMetadata(body)));
    }

    @Override
    public Operation poll(String rawHandle) {
        String handle = OperationHandle.of(rawHandle).getQualified();
        JsonNode body = call(baseUrl + "/videos/" + handle, HttpMethod.GET, null, "status");

        String status = body.path("status").asText("");
        Operation.OperationBuilder operation = Operation.builder()
                .handle(handle)
                .shortHandle(handle)
                .metadata(progressMetadata(body));

        switch (status) {
            case "completed":
                return operation.done(true).output(download(handle)).build();
            case "failed":
                String message = body.path("error").path("message").asText("Unknown error");
                log.warn("[Sora] Video {} failed: {}", handle, message);
                return operation.done(true)
                        .errorCode(ErrorCode.PROVIDER_GENERATION_FAILED)
                        .error("Sora generation failed: " + message)
                        .build();
            default:
                return operation.done(false).build();
        }
    }

    private GenerationOutput download(String videoId) {
        HttpHeaders headers = authHeaders();
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(baseUrl + "/videos/" + videoId + "/content",
                    HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        } catch (HttpStatusCodeException e) {
            throw new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED,
                    "Sora content download failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE, "Sora unreachable: " + e.getMessage(), e);
        }

        byte[] bytes = response.getBody();
        if (bytes == null || bytes.length == 0) {
            throw new ApiException(ErrorCode.DECODE_ERROR, "Sora returned empty content for " + videoId);
        }
        String storedRef = storageService.put(bytes, "videos/" + NAME + "/" + videoId + ".mp4", "video/mp4");
        log.info("[Sora] Video {} stored: {} ({} bytes)", videoId, storedRef, bytes.length);

        return GenerationOutput.builder()
                .resultRef(storedRef)
                .mimeType("video/mp4")
                .source(GenerationOutput.Source.INLINE_STORED)
                .metadataEntry("sizeBytes", bytes.length)
                .build();
    }

    private JsonNode call(String url, HttpMethod method, Object payload, String phase) {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, method, new HttpEntity<>(payload, headers), String.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw new ApiException(ErrorCode.OPERATION_NOT_FOUND, "Sora resource not found: " + url, e);
        } catch (HttpStatusCodeException e) {
            log.error("[Sora] {} failed - status: {}, body: {}", phase, e.getStatusCode(), e.getResponseBodyAsString());
            throw new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED,
                    "Sora " + phase + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE, "Sora unreachable: " + e.getMessage(), e);
        }

        try {
            return objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.DECODE_ERROR, "Malformed Sora response", e);
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        return headers;
    }

    private Map<String, Object> progressMetadata(JsonNode body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", body.path("status").asText("queued"));
        if (body.path("progress").isNumber()) {
            metadata.put("progress", body.path("progress").asInt());
        }
        return metadata;
    }

    static int toAllowedSeconds(int requested) {
        int best = ALLOWED_SECONDS[0];
        for (int allowed : ALLOWED_SECONDS) {
            if (Math.abs(allowed - requested) < Math.abs(best - requested)) {
                best = allowed;
            }
        }
        return best;
    }

    static String toSize(QualityTier tier, String aspectRatio) {
        boolean portrait = "9:16".equals(aspectRatio);
        if (tier == QualityTier.PREMIUM) {
            return portrait ? "1024x1792" : "1792x1024";
        }
        return portrait ? "720x1280" : "1280x720";
    }
}
