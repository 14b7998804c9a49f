package com.photonlab.backend.api.dto;

import com.photonlab.backend.domain.JobStatus;

public record SweepStartResponse(String jobId, JobStatus status, String message, int totalSimulations) {}
