package com.photonlab.backend.domain;

/**
 * The job exists but is in the wrong state for the requested operation.
 */
public class JobStateException extends RuntimeException {

    private final JobStatus status;

    public JobStateException(String message, JobStatus status) {
        super(message);
        this.status = status;
    }

    public JobStatus status() {
        return status;
    }
}
