package com.photonlab.backend.domain.layer;

import java.util.List;

/**
 * Ordered stack, top (superstrate side) first.
 */
public record LayerStackConfig(
        double latticeConstant,
        List<LayerDefinition> layers,
        Material superstrate,
        Material substrate,
        boolean includeBackReflector,
        Material backReflectorMaterial,
        double backReflectorThickness
) {
    public LayerStackConfig {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }
}
