package com.cinegen.api.operation;

import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderOutcome;
import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

import java.util.Collections;
import java.util.Map;

/**
 * 장기 실행 작업(LRO) 프로토콜 클라이언트
 *
 * submit → (즉시 결과 | 작업 핸들), poll → 작업 스냅샷 1회.
 * 상태를 갖지 않으며 폴링 주기와 최대 대기 시간은 호출자(워커)가 정한다.
 *
 * 폴링은 2단계로 핸들을 해석한다:
 * 1. 전체 이름으로 조회
 * 2. NOT_FOUND(HTTP 404 또는 본문 status) 이면 짧은 형식으로 1회 재시도
 * 둘 다 실패하면 OPERATION_NOT_FOUND
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LongRunningOperationClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OperationResultDecoder decoder;

    public ProviderOutcome submit(OperationEndpoint endpoint, Object payload, String suggestedName) {
        log.info("[Operation] Submitting to {}: {}", endpoint.getProvider(), endpoint.getSubmitUrl());

        JsonNode body;
        try {
            body = exchange(endpoint.getSubmitUrl(), HttpMethod.POST, payload, endpoint.getHeaders());
        } catch (HttpStatusCodeException e) {
            throw translate(endpoint, "submit", e);
        }

        decoder.checkFailure(body);

        if (decoder.containsVideo(body)) {
            log.info("[Operation] {} answered with an immediate result", endpoint.getProvider());
            return ProviderOutcome.completed(decoder.decode(body, suggestedName));
        }

        String name = body.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new ApiException(ErrorCode.DECODE_ERROR,
                    endpoint.getProvider() + " response has neither predictions nor an operation name");
        }

        OperationHandle handle = OperationHandle.of(name);
        log.info("[Operation] {} operation started: {}", endpoint.getProvider(), handle.getQualified());
        return ProviderOutcome.pending(Operation.pending(handle.getQualified(), handle.getShortForm(), metadataOf(body)));
    }

    public Operation poll(OperationEndpoint endpoint, OperationHandle handle, String suggestedName) {
        JsonNode body = fetch(endpoint, handle.getQualified());

        if (body == null && handle.hasDistinctShortForm()) {
            log.info("[Operation] Qualified handle not found, retrying with short form: {}", handle.getShortForm());
            body = fetch(endpoint, handle.getShortForm());
        }
        if (body == null) {
            throw new ApiException(ErrorCode.OPERATION_NOT_FOUND,
                    "Operation not found on " + endpoint.getProvider() + ": " + handle.getQualified());
        }

        Map<String, Object> metadata = metadataOf(body);
        if (!body.path("done").asBoolean(false)) {
            return Operation.pending(handle.getQualified(), handle.getShortForm(), metadata);
        }

        Operation.OperationBuilder done = Operation.builder()
                .handle(handle.getQualified())
                .shortHandle(handle.getShortForm())
                .done(true)
                .metadata(metadata);
        try {
            GenerationOutput output = decoder.decode(body, suggestedName);
            return done.output(output).build();
        } catch (ApiException e) {
            // 완료됐지만 실패한 작업: 예외 대신 Operation.error 로 전달
            log.warn("[Operation] {} operation {} finished with error: {}",
                    endpoint.getProvider(), handle.getShortForm(), e.getMessage());
            return done.errorCode(e.getErrorCode()).error(e.getMessage()).build();
        }
    }

    /**
     * @return 응답 본문, NOT_FOUND 계열이면 null
     */
    private JsonNode fetch(OperationEndpoint endpoint, String handleForm) {
        JsonNode body;
        try {
            if (endpoint.getPollStyle() == OperationEndpoint.PollStyle.FETCH_PREDICT) {
                body = exchange(endpoint.getPollUrl(), HttpMethod.POST,
                        Map.of("operationName", handleForm), endpoint.getHeaders());
            } else {
                body = exchange(endpoint.getPollUrl() + "/" + handleForm, HttpMethod.GET, null, endpoint.getHeaders());
            }
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("[Operation] 404 for handle {}", handleForm);
            return null;
        } catch (HttpStatusCodeException e) {
            throw translate(endpoint, "poll", e);
        }

        JsonNode error = body.path("error");
        if ("NOT_FOUND".equals(error.path("status").asText()) || error.path("code").asInt() == 404) {
            log.debug("[Operation] NOT_FOUND status for handle {}", handleForm);
            return null;
        }
        return body;
    }

    private JsonNode exchange(String url, HttpMethod method, Object payload, HttpHeaders headers) {
        HttpHeaders requestHeaders = new HttpHeaders();
        if (headers != null) {
            requestHeaders.putAll(headers);
        }
        requestHeaders.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, method, new HttpEntity<>(payload, requestHeaders), String.class);
        } catch (ResourceAccessException e) {
            throw new ApiException(ErrorCode.PROVIDER_UNAVAILABLE, "Provider unreachable: " + e.getMessage(), e);
        }

        String text = response.getBody();
        if (text == null || text.isBlank()) {
            throw new ApiException(ErrorCode.DECODE_ERROR, "Empty response body from " + url);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.DECODE_ERROR, "Malformed JSON response from " + url, e);
        }
    }

    private ApiException translate(OperationEndpoint endpoint, String phase, HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        log.error("[Operation] {} {} failed - status: {}, body: {}", endpoint.getProvider(), phase, e.getStatusCode(), body);
        return new ApiException(ErrorCode.PROVIDER_GENERATION_FAILED,
                endpoint.getProvider() + " " + phase + " failed with HTTP " + e.getStatusCode().value()
                        + (body.isBlank() ? "" : ": " + abbreviate(body)), e);
    }

    private Map<String, Object> metadataOf(JsonNode body) {
        JsonNode metadata = body.path("metadata");
        if (!metadata.isObject()) {
            return Collections.emptyMap();
        }
        return objectMapper.convertValue(metadata, MAP_TYPE);
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
