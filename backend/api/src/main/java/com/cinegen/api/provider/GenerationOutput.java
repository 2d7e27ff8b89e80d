package com.cinegen.api.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * 완료된 생성 결과
 * INLINE_STORED: 응답 본문의 바이너리를 저장소에 저장한 참조
 * REMOTE_URI: 프로바이더가 보관 중인 원격 URI 그대로
 */
@Getter
@Builder
public class GenerationOutput {

    public enum Source {
        INLINE_STORED, REMOTE_URI
    }

    private final String resultRef;
    private final String mimeType;
    private final Source source;
    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
}
