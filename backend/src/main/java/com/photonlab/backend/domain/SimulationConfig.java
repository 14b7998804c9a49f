package com.photonlab.backend.domain;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Canonical flat configuration the solver consumes. Lengths in µm, wavelengths in nm.
 */
public record SimulationConfig(
        @JsonAlias("a") double latticeConstant,
        @JsonAlias("r") double radius,
        @JsonAlias("t") double thickness,        // PCS slab
        @JsonAlias("h") double glassThickness,   // BOX / substrate
        @JsonAlias("n") double nSilicon,
        @JsonAlias("k") double kSilicon,
        double nGlass,
        int numBasis,
        Excitation excitation,
        WavelengthRange wavelength,
        boolean computePower,
        boolean computeFields
) {

    public static SimulationConfig defaults() {
        return new SimulationConfig(
                0.5, 0.15, 0.16, 3.0,
                3.68, 0.0, 1.535,
                32,
                Excitation.normalIncidenceP(),
                new WavelengthRange(800, 1200, 1),
                true, true
        );
    }

    public SimulationConfig withLatticeConstant(double v) {
        return new SimulationConfig(v, radius, thickness, glassThickness, nSilicon, kSilicon, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withRadius(double v) {
        return new SimulationConfig(latticeConstant, v, thickness, glassThickness, nSilicon, kSilicon, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withThickness(double v) {
        return new SimulationConfig(latticeConstant, radius, v, glassThickness, nSilicon, kSilicon, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withGlassThickness(double v) {
        return new SimulationConfig(latticeConstant, radius, thickness, v, nSilicon, kSilicon, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withNSilicon(double v) {
        return new SimulationConfig(latticeConstant, radius, thickness, glassThickness, v, kSilicon, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withKSilicon(double v) {
        return new SimulationConfig(latticeConstant, radius, thickness, glassThickness, nSilicon, v, nGlass,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    public SimulationConfig withNGlass(double v) {
        return new SimulationConfig(latticeConstant, radius, thickness, glassThickness, nSilicon, kSilicon, v,
                numBasis, excitation, wavelength, computePower, computeFields);
    }

    /**
     * Rewrites the slab geometry and materials in one go; excitation, wavelength, basis and output flags are kept.
     */
    public SimulationConfig withStructure(double a, double r, double t, double h, double n, double k, double nSub) {
        return new SimulationConfig(a, r, t, h, n, k, nSub,
                numBasis, excitation, wavelength, computePower, computeFields);
    }
}
