package com.photonlab.backend.domain.layer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lattice arrangement of the holes.
 */
public enum PatternType {
    SQUARE("square", "circle"),
    RECTANGULAR("rectangular", "rectangle"),
    HEXAGONAL("hexagonal", "hexagonal");

    private final String wire;
    private final String legacy;   // names older clients still send

    PatternType(String wire, String legacy) {
        this.wire = wire;
        this.legacy = legacy;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static PatternType fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (PatternType p : values()) {
            if (p.wire.equals(v) || p.legacy.equals(v)) return p;
        }
        throw new IllegalArgumentException("Unknown pattern type: " + value);
    }
}
