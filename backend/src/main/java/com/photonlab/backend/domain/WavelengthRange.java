package com.photonlab.backend.domain;

/**
 * Spectral window in nm.
 */
public record WavelengthRange(
        double start,
        double end,
        double step
) {
    // absorbs binary-fraction error, e.g. (0.6 - 0.4) / 0.1 = 1.9999999999999996
    private static final double COUNT_TOLERANCE = 1e-9;

    public int pointCount() {
        return pointCount(start, end, step);
    }

    /**
     * floor(|end - start| / step) + 1, the count used for previews and sweep expansion alike.
     */
    public static int pointCount(double start, double end, double step) {
        if (step <= 0) return 1;
        return (int) Math.floor(Math.abs(end - start) / step + COUNT_TOLERANCE) + 1;
    }
}
