package com.photonlab.backend.domain;

import java.util.List;

public record SweepPreview(
        int totalSimulations,
        long totalWavelengthPoints,
        double estimatedTimeSeconds,
        List<ParameterPoints> sweeps
) {
    public record ParameterPoints(
            SweepParameterName parameter,
            double start,
            double end,
            double step,
            int numPoints
    ) {}
}
