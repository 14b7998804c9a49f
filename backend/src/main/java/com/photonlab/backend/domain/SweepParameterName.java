package com.photonlab.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fields of {@link SimulationConfig} that may be swept.
 */
public enum SweepParameterName {
    A("a"),   // lattice constant
    R("r"),   // hole radius
    T("t"),   // slab thickness
    H("h"),   // glass thickness
    N("n"),   // silicon index
    K("k");   // silicon extinction

    private final String wire;

    SweepParameterName(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SweepParameterName fromWire(String value) {
        if (value == null) return null;
        for (SweepParameterName p : values()) {
            if (p.wire.equalsIgnoreCase(value.trim())) return p;
        }
        throw new IllegalArgumentException("Unknown sweep parameter: " + value + " (expected one of a, r, t, h, n, k)");
    }

    public SimulationConfig apply(SimulationConfig config, double value) {
        return switch (this) {
            case A -> config.withLatticeConstant(value);
            case R -> config.withRadius(value);
            case T -> config.withThickness(value);
            case H -> config.withGlassThickness(value);
            case N -> config.withNSilicon(value);
            case K -> config.withKSilicon(value);
        };
    }

    public double read(SimulationConfig config) {
        return switch (this) {
            case A -> config.latticeConstant();
            case R -> config.radius();
            case T -> config.thickness();
            case H -> config.glassThickness();
            case N -> config.nSilicon();
            case K -> config.kSilicon();
        };
    }
}
