package com.photonlab.backend.api.dto;

import java.time.Instant;

public record CleanupResponse(int removed, Instant cutoff) {}
