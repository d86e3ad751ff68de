package com.codehealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Severity implements Ranked {
    HIGH("high", 3),
    MED("med", 2),
    LOW("low", 1);

    private final String wire;
    private final int rank;

    Severity(String wire, int rank) {
        this.wire = wire;
        this.rank = rank;
    }

    @JsonValue
    @Override public String wire() { return wire; }
    @Override public int rank() { return rank; }

    public static Optional<Severity> fromWire(String raw) {
        return WireNamed.lookup(Severity.class, raw);
    }
}
