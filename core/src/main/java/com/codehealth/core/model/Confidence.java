package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** 탐지 확신도. severity와 같은 3단계지만 별도 축이다. */
public enum Confidence implements Ranked {
    HIGH("high", 3),
    MED("med", 2),
    LOW("low", 1);

    private final String wire;
    private final int rank;

    Confidence(String wire, int rank) {
        this.wire = wire;
        this.rank = rank;
    }

    @JsonValue
    @Override public String wire() { return wire; }
    @Override public int rank() { return rank; }

    public static Optional<Confidence> fromWire(String raw) {
        return WireNamed.lookup(Confidence.class, raw);
    }
}
