package com.photonlab.backend.domain;

/**
 * A {@link JobInfo} tagged with the job's mutation counter so stale pushes can be dropped.
 */
public record JobSnapshot(
        long version,
        JobInfo info
) {
    public String jobId() {
        return info.jobId();
    }

    public boolean isTerminal() {
        return info.status().isTerminal();
    }
}
