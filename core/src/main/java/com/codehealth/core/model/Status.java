package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** 처리 상태. 순위 없음: 병합 시 OPEN이 우선한다. */
public enum Status implements WireNamed {
    OPEN("open"),
    FIXED("fixed"),
    WONTFIX("wontfix"),
    FALSE_POSITIVE("false_positive");

    private final String wire;

    Status(String wire) { this.wire = wire; }

    @JsonValue
    @Override public String wire() { return wire; }

    public static Optional<Status> fromWire(String raw) {
        return WireNamed.lookup(Status.class, raw);
    }
}
