package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** 거친 심각도 분류: T1(가장 심각) ~ T4(가장 약함) */
public enum Tier implements Ranked {
    T1("T1", 4),
    T2("T2", 3),
    T3("T3", 2),
    T4("T4", 1);

    private final String wire;
    private final int rank;

    Tier(String wire, int rank) {
        this.wire = wire;
        this.rank = rank;
    }

    @JsonValue
    @Override public String wire() { return wire; }
    @Override public int rank() { return rank; }

    public static Optional<Tier> fromWire(String raw) {
        return WireNamed.lookup(Tier.class, raw);
    }
}
