package com.photonlab.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Consistent point-in-time view of a {@link SweepJob}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobInfo(
        String jobId,
        JobStatus status,
        ProgressUpdate progress,
        String error,
        List<SlotFailure> failedSlots,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {}
