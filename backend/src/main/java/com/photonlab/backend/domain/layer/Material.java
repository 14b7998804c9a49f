package com.photonlab.backend.domain.layer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Materials a layer can be made of, with their default optical constants.
 */
public enum Material {
    VACUUM("Vacuum", 1.0, 0.0),
    SILICON("Silicon", 3.48, 0.0),
    GLASS("Glass", 1.535, 0.0),
    GOLD("Gold", 0.18, 3.0),
    PMMA("PMMA", 1.49, 0.0),
    GRAPHENE("Graphene", 2.7, 1.4),
    GAAS("GaAs", 3.59, 0.0),
    SILICON_SUBSTRATE("SiliconSubstrate", 3.42, 0.0),
    CUSTOM("Custom", 1.5, 0.0);

    private final String label;
    private final double defaultN;
    private final double defaultK;

    Material(String label, double defaultN, double defaultK) {
        this.label = label;
        this.defaultN = defaultN;
        this.defaultK = defaultK;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double defaultN() {
        return defaultN;
    }

    public double defaultK() {
        return defaultK;
    }

    @JsonCreator
    public static Material fromLabel(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        for (Material m : values()) {
            if (m.label.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v)) return m;
        }
        throw new IllegalArgumentException("Unknown material: " + value);
    }
}
