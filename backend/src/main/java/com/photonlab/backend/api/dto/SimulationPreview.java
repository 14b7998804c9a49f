package com.photonlab.backend.api.dto;

import com.photonlab.backend.domain.WavelengthRange;

public record SimulationPreview(
        int numWavelengths,
        WavelengthRange wavelengthRange,
        double estimatedTimeSeconds,
        int cpuCount
) {}
