package com.photonlab.backend.domain;

public record ProgressUpdate(
        int current,
        int total,
        double percent,
        String message,
        Double estimatedRemainingSeconds
) {}
