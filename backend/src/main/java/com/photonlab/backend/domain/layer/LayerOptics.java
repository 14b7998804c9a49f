package com.photonlab.backend.domain.layer;

/**
 * Effective optical constants of a layer; ε = (n² − k²) + i·2nk unless overridden.
 */
public record LayerOptics(
        double n,
        double k,
        double epsilonReal,
        double epsilonImag
) {}
