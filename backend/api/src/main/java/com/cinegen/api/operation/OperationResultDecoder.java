package com.cinegen.api.operation;

import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.storage.StorageService;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 완료된 작업 응답에서 영상 결과 추출
 *
 * 지원 형식:
 * - response.videos[]
 * - response.generateVideoResponse.generatedSamples[].video
 * - response.predictions[].generatedSamples[].video
 * - predictions[] (즉시 응답)
 *
 * bytesBase64Encoded 는 디코딩 후 저장소에 저장하고, gcsUri / uri / videoUri 는 그대로 전달한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationResultDecoder {

    private static final String DEFAULT_MIME_TYPE = "video/mp4";

    private final StorageService storageService;

    /**
     * @param body 작업 응답 전체 (response 를 포함) 또는 즉시 응답 본문
     * @param suggestedName 인라인 결과 저장 경로 힌트
     */
    public GenerationOutput decode(JsonNode body, String suggestedName) {
        checkFailure(body);

        JsonNode response = body.has("response") ? body.path("response") : body;
        List<JsonNode> videos = collectVideos(response);
        if (videos.isEmpty()) {
            throw new ApiException(ErrorCode.DECODE_ERROR,
                    "No video found in operation result (keys: " + fieldNames(response) + ")");
        }

        JsonNode video = videos.get(0);
        String mimeType = video.path("mimeType").asText(DEFAULT_MIME_TYPE);

        String base64 = video.path("bytesBase64Encoded").asText(null);
        if (base64 != null && !base64.isEmpty()) {
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(base64);
            } catch (IllegalArgumentException e) {
                throw new ApiException(ErrorCode.DECODE_ERROR, "Invalid base64 video payload", e);
            }
            String storedRef = storageService.put(bytes, suggestedName, mimeType);
            log.info("[Operation] Inline video stored: {} ({} bytes)", storedRef, bytes.length);
            return GenerationOutput.builder()
                    .resultRef(storedRef)
                    .mimeType(mimeType)
                    .source(GenerationOutput.Source.INLINE_STORED)
                    .metadataEntry("sizeBytes", bytes.length)
                    .build();
        }

        String uri = firstText(video, "gcsUri", "uri", "videoUri");
        if (uri != null) {
            log.info("[Operation] Remote video URI: {}", uri);
            return GenerationOutput.builder()
                    .resultRef(uri)
                    .mimeType(mimeType)
                    .source(GenerationOutput.Source.REMOTE_URI)
                    .build();
        }

        throw new ApiException(ErrorCode.DECODE_ERROR,
                "Video entry has neither inline bytes nor a URI (keys: " + fieldNames(video) + ")");
    }

    /**
     * 작업 오류 또는 콘텐츠 필터 결과면 PROVIDER_GENERATION_FAILED
     */
    public void checkFailure(JsonNode body) {
        if (body.hasNonNull("error")) {
            JsonNode error = body.path("error");
            String message = error.isTextual() ? error.asText() : error.path("message").asText("Unknown error");
            throw new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED, "Operation failed: " + message);
        }

        JsonNode response = body.has("response") ? body.path("response") : body;
        JsonNode reasons = response.path("raiMediaFilteredReasons");
        if (!reasons.isArray() || reasons.isEmpty()) {
            reasons = response.path("generateVideoResponse").path("raiMediaFilteredReasons");
        }
        if (reasons.isArray() && !reasons.isEmpty()) {
            List<String> texts = new ArrayList<>();
            reasons.forEach(r -> texts.add(r.asText()));
            throw new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED,
                    "Content filtered: " + String.join("; ", texts));
        }
    }

    /**
     * 즉시 응답이 영상을 포함하고 있는지
     */
    public boolean containsVideo(JsonNode body) {
        JsonNode response = body.has("response") ? body.path("response") : body;
        return !collectVideos(response).isEmpty();
    }

    private List<JsonNode> collectVideos(JsonNode response) {
        List<JsonNode> videos = new ArrayList<>();

        JsonNode direct = response.path("videos");
        if (direct.isArray()) {
            direct.forEach(v -> videos.add(v.has("video") ? v.path("video") : v));
        }

        JsonNode samples = response.path("generateVideoResponse").path("generatedSamples");
        if (samples.isArray()) {
            samples.forEach(s -> videos.add(s.path("video")));
        }

        JsonNode predictions = response.path("predictions");
        if (predictions.isArray()) {
            for (JsonNode prediction : predictions) {
                JsonNode nested = prediction.path("generatedSamples");
                if (nested.isArray() && !nested.isEmpty()) {
                    nested.forEach(s -> videos.add(s.path("video")));
                } else {
                    videos.add(prediction);
                }
            }
        }

        videos.removeIf(v -> !v.isObject());
        return videos;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private String fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names.toString();
    }
}
