package com.photonlab.backend.domain;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server-owned state of one sweep.
 *
 * <p>Lifecycle: {@code pending -> running -> completed | failed | cancelled}. Terminal states are final.
 * Every read and write goes through {@link #lock}, so {@code current}, the result slots and the status
 * are always observed together.
 */
public class SweepJob {

    private final String id;
    private final long sequence;
    private final SweepConfig request;
    private final int total;
    private final int latencyWindow;
    private final Clock clock;
    private final Instant createdAt;

    private final ReentrantLock lock = new ReentrantLock();
    private final SimulationResult[] results;
    private final List<SlotFailure> failures = new ArrayList<>();
    private final Deque<Long> recentLatencies = new ArrayDeque<>();

    private JobStatus status = JobStatus.PENDING;
    private String message = "Job queued";
    private String error;
    private Double estimatedRemainingSeconds;
    private Instant startedAt;
    private Instant finishedAt;

    private int nextIndex;
    private int inFlight;
    private int settled;
    private int workerCount = 1;
    private boolean cancelRequested;
    private long version;

    public SweepJob(String id, long sequence, SweepConfig request, int total, int latencyWindow, Clock clock) {
        if (total < 1) throw new IllegalArgumentException("total must be >= 1");
        this.id = id;
        this.sequence = sequence;
        this.request = request;
        this.total = total;
        this.latencyWindow = Math.max(1, latencyWindow);
        this.clock = clock;
        this.createdAt = clock.instant();
        this.results = new SimulationResult[total];
    }

    public String id() { return id; }
    public long sequence() { return sequence; }
    public SweepConfig request() { return request; }
    public int total() { return total; }
    public Instant createdAt() { return createdAt; }

    public void assignWorkers(int workers) {
        lock.lock();
        try {
            this.workerCount = Math.max(1, workers);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands out the next undispatched position.
     *
     * @return the claim, or {@code null} once the job is cancelled, terminal or fully dispatched
     */
    public Claim claimNext() {
        lock.lock();
        try {
            if (cancelRequested || status.isTerminal() || nextIndex >= total) return null;
            boolean started = false;
            if (status == JobStatus.PENDING) {
                status = JobStatus.RUNNING;
                startedAt = clock.instant();
                message = "Running " + total + " simulations";
                started = true;
                version++;
            }
            inFlight++;
            return new Claim(nextIndex++, started);
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot complete(int index, SimulationResult result, long latencyNanos) {
        return settle(index, result, null, latencyNanos);
    }

    public JobSnapshot fail(int index, String reason, long latencyNanos) {
        return settle(index, null, reason == null ? "Simulation failed" : reason, latencyNanos);
    }

    /**
     * Gives back a claimed slot that was never run because the job is being cancelled.
     *
     * @return the cancelled snapshot once the last in-flight slot is given back, otherwise {@code null}
     */
    public JobSnapshot discard(int index) {
        lock.lock();
        try {
            if (!cancelRequested) throw new IllegalStateException("slot " + index + " of job " + id + " discarded without a cancel");
            return settle(index, null, "Cancelled", 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the updated snapshot, or {@code null} when the outcome was discarded because of cancellation
     */
    private JobSnapshot settle(int index, SimulationResult result, String reason, long latencyNanos) {
        lock.lock();
        try {
            if (index < 0 || index >= total) throw new IndexOutOfBoundsException("slot " + index + " of " + total);
            inFlight = Math.max(0, inFlight - 1);
            if (status.isTerminal()) return null;
            if (cancelRequested) {
                if (inFlight == 0) {
                    finish(JobStatus.CANCELLED, "Cancelled after " + settled + "/" + total + " simulations");
                    return snapshotLocked();
                }
                return null;
            }

            if (reason == null) {
                results[index] = result;
            } else {
                failures.add(new SlotFailure(index, reason));
            }
            settled++;
            recordLatency(latencyNanos);

            if (settled == total) {
                if (failures.size() == total) {
                    error = "All " + total + " simulations failed; first error: " + firstFailure().message();
                    finish(JobStatus.FAILED, "Failed");
                } else if (failures.isEmpty()) {
                    finish(JobStatus.COMPLETED, "Completed successfully");
                } else {
                    finish(JobStatus.COMPLETED, "Completed with " + failures.size() + " failed simulation(s)");
                }
            } else {
                message = "Completed " + settled + "/" + total + " simulations";
                estimatedRemainingSeconds = estimateRemaining();
                version++;
            }
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cooperative cancellation. A terminal job is left untouched and its snapshot returned.
     */
    public JobSnapshot requestCancel() {
        lock.lock();
        try {
            if (status.isTerminal() || cancelRequested) return snapshotLocked();
            cancelRequested = true;
            if (inFlight == 0) {
                finish(JobStatus.CANCELLED, "Cancelled after " + settled + "/" + total + " simulations");
            } else {
                message = "Cancelling; waiting for " + inFlight + " running simulation(s)";
                version++;
            }
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails the whole job, e.g. when no worker could be scheduled.
     */
    public JobSnapshot abort(String reason) {
        lock.lock();
        try {
            if (status.isTerminal()) return snapshotLocked();
            error = reason;
            finish(JobStatus.FAILED, "Failed");
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public JobStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public Instant finishedAt() {
        lock.lock();
        try {
            return finishedAt;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelRequested() {
        lock.lock();
        try {
            return cancelRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Slot-ordered results; failed or never-run slots are {@code null}.
     */
    public List<SimulationResult> results() {
        lock.lock();
        try {
            return Collections.unmodifiableList(Arrays.asList(results.clone()));
        } finally {
            lock.unlock();
        }
    }

    public List<SlotFailure> failures() {
        lock.lock();
        try {
            return sortedFailures();
        } finally {
            lock.unlock();
        }
    }

    // ---------------- helpers (lock held) ----------------

    private void finish(JobStatus terminal, String msg) {
        status = terminal;
        message = msg;
        estimatedRemainingSeconds = terminal == JobStatus.COMPLETED ? 0.0 : null;
        finishedAt = clock.instant();
        version++;
    }

    private void recordLatency(long latencyNanos) {
        recentLatencies.addLast(Math.max(0L, latencyNanos));
        while (recentLatencies.size() > latencyWindow) recentLatencies.removeFirst();
    }

    private Double estimateRemaining() {
        if (recentLatencies.isEmpty()) return null;
        double avgSeconds = recentLatencies.stream().mapToLong(Long::longValue).average().orElse(0) / 1e9;
        int remaining = total - settled;
        return avgSeconds * remaining / workerCount;
    }

    private SlotFailure firstFailure() {
        return sortedFailures().get(0);
    }

    private List<SlotFailure> sortedFailures() {
        List<SlotFailure> copy = new ArrayList<>(failures);
        copy.sort((x, y) -> Integer.compare(x.index(), y.index()));
        return List.copyOf(copy);
    }

    private JobSnapshot snapshotLocked() {
        ProgressUpdate progress = new ProgressUpdate(
                settled,
                total,
                100.0 * settled / total,
                message,
                estimatedRemainingSeconds
        );
        JobInfo info = new JobInfo(
                id,
                status,
                progress,
                error,
                failures.isEmpty() ? null : sortedFailures(),
                createdAt,
                startedAt,
                finishedAt
        );
        return new JobSnapshot(version, info);
    }

    /**
     * One dispatched position. {@code started} is true for the claim that moved the job to running.
     */
    public record Claim(int index, boolean started) {}
}
