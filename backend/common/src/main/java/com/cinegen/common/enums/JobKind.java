package com.cinegen.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum JobKind {

    VIDEO("video", "영상 생성");

    private final String code;
    private final String displayName;

    public static Optional<JobKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(code.trim()) || k.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
