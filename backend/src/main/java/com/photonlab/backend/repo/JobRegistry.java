package com.photonlab.backend.repo;

import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.JobInfo;
import com.photonlab.backend.domain.JobStateException;
import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepJob;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide table of sweep jobs. Lives as long as the application context; nothing is persisted.
 * Entries leave only through {@link #remove} or {@link #evictFinishedBefore}.
 */
@Component
public class JobRegistry {

    public static final int MAX_PAGE = 1000;

    private final ConcurrentHashMap<String, SweepJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int latencyWindow;
    private final Clock clock;

    @Autowired
    public JobRegistry(PhotonLabProperties properties) {
        this(properties.getSweep().getLatencyWindow(), Clock.systemUTC());
    }

    public JobRegistry(int latencyWindow, Clock clock) {
        this.latencyWindow = latencyWindow;
        this.clock = clock;
    }

    public SweepJob create(SweepConfig request, int total) {
        String id = UUID.randomUUID().toString();
        SweepJob job = new SweepJob(id, sequence.incrementAndGet(), request, total, latencyWindow, clock);
        jobs.put(id, job);
        return job;
    }

    public Optional<SweepJob> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(id));
    }

    public SweepJob require(String id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("Job not found: " + id));
    }

    /**
     * Newest first. {@code limit} is capped at {@value #MAX_PAGE}.
     */
    public List<JobInfo> list(JobStatus status, int limit, int offset) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive, got " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset cannot be negative, got " + offset);
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(SweepJob::sequence).reversed())
                .map(j -> j.snapshot().info())
                .filter(info -> status == null || info.status() == status)
                .skip(offset)
                .limit(Math.min(limit, MAX_PAGE))
                .toList();
    }

    public void remove(String id) {
        SweepJob job = require(id);
        JobStatus status = job.status();
        if (!status.isTerminal()) {
            throw new JobStateException("Job " + id + " is still " + status.wire() + "; cancel it first", status);
        }
        jobs.remove(id, job);
    }

    /**
     * Drops finished jobs whose finish time is before {@code cutoff}.
     *
     * @return number of jobs removed
     */
    public int evictFinishedBefore(Instant cutoff) {
        int removed = 0;
        for (SweepJob job : jobs.values()) {
            Instant finished = job.finishedAt();
            if (finished != null && finished.isBefore(cutoff) && jobs.remove(job.id(), job)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return jobs.size();
    }

    public Clock clock() {
        return clock;
    }
}
