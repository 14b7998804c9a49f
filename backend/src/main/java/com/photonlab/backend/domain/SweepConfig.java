package com.photonlab.backend.domain;

import java.util.List;

/**
 * A base configuration plus independent ranges; first sweep varies slowest.
 */
public record SweepConfig(
        SimulationConfig baseConfig,
        List<SweepParameter> sweeps
) {
    public SweepConfig {
        sweeps = sweeps == null ? List.of() : List.copyOf(sweeps);
    }
}
