package com.photonlab.backend.domain;

/**
 * Computation error recorded against one position of the expanded configuration list.
 */
public record SlotFailure(
        int index,
        String message
) {}
