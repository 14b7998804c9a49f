package com.photonlab.backend.domain;

public record SweepParameter(
        SweepParameterName name,
        double start,
        double end,
        double step
) {
    public int pointCount() {
        return WavelengthRange.pointCount(start, end, step);
    }
}
