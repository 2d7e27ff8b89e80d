package com.cinegen.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 생성 작업 상태
 * QUEUED → PROCESSING → COMPLETED | FAILED, QUEUED | PROCESSING → CANCELLED
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    QUEUED("QUEUED", "대기중"),
    PROCESSING("PROCESSING", "생성중"),
    COMPLETED("COMPLETED", "완료"),
    FAILED("FAILED", "실패"),
    CANCELLED("CANCELLED", "취소됨");

    public static final Set<JobStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING);

    private final String code;
    private final String description;

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
