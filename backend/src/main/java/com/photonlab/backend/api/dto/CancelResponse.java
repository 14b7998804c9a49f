package com.photonlab.backend.api.dto;

import com.photonlab.backend.domain.JobStatus;

public record CancelResponse(String jobId, JobStatus status, String message) {}
