package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * 분석 태스크가 사용하는 탐지기 (닫힌 집합).
 * cosmetic=true 는 기본 quick-win 분류 대상(이름/디버그 로그 정리 등 구조 변경 불필요).
 */
public enum Detector implements WireNamed {
    // ===== 구조 =====
    DEAD_UNUSED_CODE("dead_unused_code", false),
    DUPLICATION("duplication", false),

    // ===== 아키텍처 =====
    COMPLEXITY_SIZE("complexity_size", false),
    DEPENDENCY_COUPLING("dependency_coupling", false),

    // ===== 위생(cosmetic) =====
    NAMING_CONSISTENCY("naming_consistency", true),
    DEBUG_LOGGING_LEFTOVERS("debug_logging_leftovers", true);

    private final String wire;
    private final boolean cosmetic;

    Detector(String wire, boolean cosmetic) {
        this.wire = wire;
        this.cosmetic = cosmetic;
    }

    @JsonValue
    @Override public String wire() { return wire; }
    public boolean isCosmetic() { return cosmetic; }

    public static Optional<Detector> fromWire(String raw) {
        return WireNamed.lookup(Detector.class, raw);
    }
}
