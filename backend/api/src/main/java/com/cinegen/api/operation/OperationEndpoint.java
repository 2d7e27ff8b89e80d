package com.cinegen.api.operation;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;

/**
 * 장기 실행 작업 엔드포인트 정의
 *
 * FETCH_PREDICT: Vertex AI. POST {pollUrl} 본문 {"operationName": handle}
 * GET_RESOURCE:  Gemini API. GET {pollUrl}/{handle}
 */
@Getter
@Builder
public class OperationEndpoint {

    public enum PollStyle {
        FETCH_PREDICT, GET_RESOURCE
    }

    private final String provider;
    private final String submitUrl;
    private final String pollUrl;
    private final PollStyle pollStyle;
    private final HttpHeaders headers;
}
