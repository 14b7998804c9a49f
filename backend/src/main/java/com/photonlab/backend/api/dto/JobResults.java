package com.photonlab.backend.api.dto;

import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.domain.SlotFailure;

import java.util.List;

/**
 * Slot-ordered results of a finished sweep. A failed or never-run slot is {@code null} in {@code results}.
 */
public record JobResults(
        String jobId,
        JobStatus status,
        int total,
        List<SimulationResult> results,
        List<SlotFailure> failures
) {}
