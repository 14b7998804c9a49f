package com.photonlab.backend.domain;

/**
 * Incident plane wave. Angles in degrees, amplitudes are relative (0..1).
 */
public record Excitation(
        double theta,       // polar, 0..90
        double phi,         // azimuthal, 0..360
        double sAmplitude,
        double pAmplitude
) {
    public static Excitation normalIncidenceP() {
        return new Excitation(0, 0, 0, 1);
    }
}
