package com.cinegen.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 영상 품질 티어
 * STANDARD: 720p, 빠른 생성
 * PREMIUM: 1080p, 고품질 ("hd" 힌트는 PREMIUM으로 취급)
 */
@Getter
@RequiredArgsConstructor
public enum QualityTier {

    STANDARD("standard", "일반", "720p", List.of("sd", "standard", "fast")),
    PREMIUM("premium", "프리미엄", "1080p", List.of("hd", "premium", "high"));

    private final String code;
    private final String displayName;
    private final String resolution;
    private final List<String> aliases;

    public static Optional<QualityTier> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized) || t.aliases.contains(normalized))
                .findFirst();
    }
}
