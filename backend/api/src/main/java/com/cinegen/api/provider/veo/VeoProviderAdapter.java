package com.cinegen.api.provider.veo;

import com.cinegen.api.operation.LongRunningOperationClient;
import com.cinegen.api.operation.OperationEndpoint;
import com.cinegen.api.operation.OperationHandle;
import com.cinegen.api.provider.GenerationRequest;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderOutcome;
import com.cinegen.api.provider.ReferenceAsset;
import com.cinegen.api.provider.VideoProviderAdapter;
import com.cinegen.common.enums.QualityTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Veo 어댑터
 *
 * - project-id + access-token 이 있으면 Vertex AI (predictLongRunning / fetchPredictOperation)
 * - 그 외 api-key 가 있으면 Gemini API (predictLongRunning / GET operations)
 * - 둘 다 없으면 사용 불가
 */
@Slf4j
@Component
public class VeoProviderAdapter implements VideoProviderAdapter {

    public static final String NAME = "veo";

    private static final String VERTEX_MODEL_URL =
            "https://%s-aiplatform.googleapis.com/v1/projects/%s/locations/%s/publishers/google/models/%s";
    private static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final int MAX_REFERENCE_IMAGES = 3;

    private final LongRunningOperationClient operationClient;
    private final String projectId;
    private final String location;
    private final String accessToken;
    private final String apiKey;
    private final String model;
    private final boolean useReferenceImages;
    private final boolean generateAudio;

    public VeoProviderAdapter(LongRunningOperationClient operationClient,
                              @Value("${cinegen.providers.veo.project-id:}") String projectId,
                              @Value("${cinegen.providers.veo.location:us-central1}") String location,
                              @Value("${cinegen.providers.veo.access-token:}") String accessToken,
                              @Value("${cinegen.providers.veo.api-key:}") String apiKey,
                              @Value("${cinegen.providers.veo.model:veo-3.1-generate-preview}") String model,
                              @Value("${cinegen.providers.veo.use-reference-images:false}") boolean useReferenceImages,
                              @Value("${cinegen.providers.veo.generate-audio:true}") boolean generateAudio) {
        this.operationClient = operationClient;
        this.projectId = projectId;
        this.location = location;
        this.accessToken = accessToken;
        this.apiKey = apiKey;
        this.model = model;
        this.useReferenceImages = useReferenceImages;
        this.generateAudio = generateAudio;
        log.info("[Veo] Adapter initialized - mode: {}, model: {}, available: {}", mode(), model, isAvailable());
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
        return isVertex() || hasText(apiKey);
    }

    @Override
    public ProviderOutcome submit(GenerationRequest request) {
        Map<String, Object> payload = buildPayload(request);
        log.info("[Veo] Generating video - mode: {}, tier: {}, duration: {}s, references: {}",
                mode(), request.getQualityTier(), request.getDurationSeconds(), request.getReferences().size());
        return operationClient.submit(endpoint(), payload, request.suggestedOutputName(NAME, "mp4"));
    }

    @Override
    public Operation poll(String handle) {
        OperationHandle operationHandle = OperationHandle.of(handle);
        return operationClient.poll(endpoint(), operationHandle, "videos/" + NAME + "/" + operationHandle.getShortForm() + ".mp4");
    }

    /**
     * 요청 본문
     * {"instances":[{"prompt":..., "referenceImages":[...]}], "parameters":{...}}
     */
    Map<String, Object> buildPayload(GenerationRequest request) {
        Map<String, Object> instance = new LinkedHashMap<>();
        instance.put("prompt", request.getPrompt());

        if (useReferenceImages && !request.getReferences().isEmpty()) {
            List<Map<String, Object>> referenceImages = new ArrayList<>();
            for (ReferenceAsset asset : request.getReferences()) {
                if (referenceImages.size() >= MAX_REFERENCE_IMAGES) {
                    break;
                }
                Map<String, Object> image = new LinkedHashMap<>();
                if (asset.isInline()) {
                    image.put("bytesBase64Encoded", Base64.getEncoder().encodeToString(asset.getBytes()));
                } else if (hasText(asset.getUri())) {
                    image.put("gcsUri", asset.getUri());
                } else {
                    continue;
                }
                image.put("mimeType", asset.getMimeType() != null ? asset.getMimeType() : "image/png");
                referenceImages.add(Map.of("image", image, "referenceType", "asset"));
            }
            if (!referenceImages.isEmpty()) {
                instance.put("referenceImages", referenceImages);
            }
        }

        QualityTier tier = request.getQualityTier() != null ? request.getQualityTier() : QualityTier.STANDARD;
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("aspectRatio", request.getAspectRatio());
        parameters.put("durationSeconds", String.valueOf(request.getDurationSeconds()));
        parameters.put("sampleCount", 1);
        parameters.put("personGeneration", "allow_all");
        parameters.put("resolution", tier.getResolution());
        parameters.put("generateAudio", generateAudio);
        parameters.put("includeRaiReason", true);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instances", List.of(instance));
        payload.put("parameters", parameters);
        return payload;
    }

    OperationEndpoint endpoint() {
        HttpHeaders headers = new HttpHeaders();
        if (isVertex()) {
            String modelUrl = String.format(VERTEX_MODEL_URL, location, projectId, location, model);
            headers.setBearerAuth(accessToken);
            return OperationEndpoint.builder()
                    .provider(NAME)
                    .submitUrl(modelUrl + ":predictLongRunning")
                    .pollUrl(modelUrl + ":fetchPredictOperation")
                    .pollStyle(OperationEndpoint.PollStyle.FETCH_PREDICT)
                    .headers(headers)
                    .build();
        }
        headers.set("x-goog-api-key", apiKey);
        return OperationEndpoint.builder()
                .provider(NAME)
                .submitUrl(GEMINI_BASE_URL + "/models/" + model + ":predictLongRunning")
                .pollUrl(GEMINI_BASE_URL)
                .pollStyle(OperationEndpoint.PollStyle.GET_RESOURCE)
                .headers(headers)
                .build();
    }

    private boolean isVertex() {
        return hasText(projectId) && hasText(accessToken);
    }

    private String mode() {
        if (isVertex()) {
            return "vertex";
        }
        return hasText(apiKey) ? "gemini" : "none";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
