package com.photonlab.backend.domain;

import java.time.Instant;

/**
 * Listing entry for a saved config or result file. {@code name} is the file name without extension.
 */
public record StoredFile(String name, String fileName, Instant modified, long size) {}
