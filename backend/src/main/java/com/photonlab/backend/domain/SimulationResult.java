package com.photonlab.backend.domain;

import java.util.List;

/**
 * Spectra returned by the solver for one configuration. Phases are in units of π.
 */
public record SimulationResult(
        List<Double> wavelengths,
        List<Double> transmittance,
        List<Double> reflectance,
        List<Double> absorptance,
        List<Double> transmissionPhase,
        List<Double> reflectionPhase,
        SimulationConfig config
) {}
