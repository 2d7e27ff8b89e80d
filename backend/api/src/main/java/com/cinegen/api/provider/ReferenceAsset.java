package com.cinegen.api.provider;

import lombok.Builder;
import lombok.Getter;

/**
 * 생성 요청에 첨부되는 참조 자산 (페르소나 이미지 등)
 * bytes 또는 uri 중 하나만 채워진다.
 */
@Getter
@Builder
public class ReferenceAsset {
    private final byte[] bytes;
    private final String uri;
    private final String mimeType;
    private final String role;      // 예: "persona", "style"

    public boolean isInline() {
        return bytes != null && bytes.length > 0;
    }
}
