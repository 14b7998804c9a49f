package com.photonlab.backend.service;

import com.photonlab.backend.api.dto.CancelResponse;
import com.photonlab.backend.api.dto.CleanupResponse;
import com.photonlab.backend.api.dto.JobResults;
import com.photonlab.backend.api.dto.SweepStartResponse;
import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.JobInfo;
import com.photonlab.backend.domain.JobSnapshot;
import com.photonlab.backend.domain.JobStateException;
import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepJob;
import com.photonlab.backend.domain.SweepPreview;
import com.photonlab.backend.domain.ValidationResult;
import com.photonlab.backend.repo.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for everything sweep related: start, preview, status, results, cancel and job housekeeping.
 */
@Service
public class SweepService {

    private static final Logger log = LoggerFactory.getLogger(SweepService.class);

    private final ConfigValidator validator;
    private final SweepPlanner planner;
    private final JobRegistry registry;
    private final SweepWorkerPool workerPool;
    private final ProgressBroadcaster broadcaster;
    private final Duration retention;

    @Autowired
    public SweepService(ConfigValidator validator,
                        SweepPlanner planner,
                        JobRegistry registry,
                        SweepWorkerPool workerPool,
                        ProgressBroadcaster broadcaster,
                        PhotonLabProperties properties) {
        this(validator, planner, registry, workerPool, broadcaster, properties.getJobs().getRetention());
    }

    public SweepService(ConfigValidator validator,
                        SweepPlanner planner,
                        JobRegistry registry,
                        SweepWorkerPool workerPool,
                        ProgressBroadcaster broadcaster,
                        Duration retention) {
        this.validator = validator;
        this.planner = planner;
        this.registry = registry;
        this.workerPool = workerPool;
        this.broadcaster = broadcaster;
        this.retention = retention;
    }

    /**
     * Validates, expands and registers the sweep, then hands it to the worker pool without waiting.
     *
     * @throws ConfigValidationException when the base configuration or a range is invalid, or the sweep
     *         expands past {@code photonlab.sweep.max-simulations}
     */
    public SweepStartResponse startSweep(SweepConfig request) {
        ValidationResult validation = validator.validateSweep(request);
        if (!validation.valid()) throw new ConfigValidationException(validation);

        List<SimulationConfig> configs = planner.expand(request);
        SweepJob job = registry.create(request, configs.size());
        log.info("job {} created: {} simulation(s) over {} parameter(s)", job.id(), configs.size(), request.sweeps().size());

        workerPool.launch(job, configs);
        JobInfo info = job.snapshot().info();
        return new SweepStartResponse(job.id(), info.status(),
                "Sweep started with " + configs.size() + " simulations", configs.size());
    }

    /**
     * Sizes and time estimate. Only the ranges are checked; the base config just feeds the wavelength count.
     */
    public SweepPreview preview(SweepConfig request) {
        if (request == null) throw new IllegalArgumentException("Sweep request is required");
        ValidationResult validation = validator.validateSweepParameters(request.sweeps());
        if (!validation.valid()) throw new ConfigValidationException(validation);
        return planner.preview(request, workerPool.workersPerJob());
    }

    public JobInfo getStatus(String jobId) {
        return registry.require(jobId).snapshot().info();
    }

    /**
     * @throws JobStateException while the job is still pending or running
     */
    public JobResults getResults(String jobId) {
        SweepJob job = registry.require(jobId);
        JobStatus status = job.status();
        if (!status.isTerminal()) {
            throw new JobStateException("Job " + jobId + " has not finished yet (" + status.wire() + ")", status);
        }
        return new JobResults(job.id(), status, job.total(), job.results(), job.failures());
    }

    public CancelResponse cancelSweep(String jobId) {
        SweepJob job = registry.require(jobId);
        boolean alreadyFinished = job.status().isTerminal();
        JobSnapshot snapshot = job.requestCancel();
        if (!alreadyFinished) {
            log.info("job {} cancel requested ({})", jobId, snapshot.info().status().wire());
            broadcaster.publish(snapshot);
        }
        JobInfo info = snapshot.info();
        return new CancelResponse(jobId, info.status(), info.progress().message());
    }

    /**
     * Streams snapshots of the job to {@code listener}, starting with the current one.
     */
    public ProgressBroadcaster.Subscription subscribe(String jobId, ProgressListener listener) {
        return broadcaster.subscribe(registry.require(jobId), listener);
    }

    public List<JobInfo> list(JobStatus status, int limit, int offset) {
        return registry.list(status, limit, offset);
    }

    public void delete(String jobId) {
        registry.remove(jobId);
        log.info("job {} deleted", jobId);
    }

    /**
     * Drops terminal jobs finished more than {@code days} ago; {@code null} uses the configured retention.
     */
    public CleanupResponse cleanup(Integer days) {
        if (days != null && days < 0) throw new IllegalArgumentException("days must be >= 0");
        Duration age = days == null ? retention : Duration.ofDays(days);
        Instant cutoff = registry.clock().instant().minus(age);
        int removed = registry.evictFinishedBefore(cutoff);
        log.info("cleanup removed {} job(s) finished before {}", removed, cutoff);
        return new CleanupResponse(removed, cutoff);
    }
}
