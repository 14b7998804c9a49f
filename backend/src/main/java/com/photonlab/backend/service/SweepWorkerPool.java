package com.photonlab.backend.service;

import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.JobSnapshot;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.domain.SweepJob;
import com.photonlab.backend.domain.ValidationError;
import com.photonlab.backend.domain.ValidationResult;
import com.photonlab.backend.service.solver.SolverException;
import com.photonlab.backend.service.solver.SpectrumSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs a job's configurations with bounded parallelism.
 *
 * <p>Each job gets up to {@code max-workers-per-job} worker loops. A loop claims the next undispatched
 * position, takes a permit from the global {@code solveSlots} semaphore, calls the solver and reports back.
 * A permit is held for as long as the solver call itself runs, timed out or not.
 * Results land at their request position whatever order the workers finish in.
 */
@Component
public class SweepWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(SweepWorkerPool.class);

    private final SpectrumSolver solver;
    private final ConfigValidator validator;
    private final ProgressBroadcaster broadcaster;
    private final ExecutorService workers;
    private final ExecutorService solverCalls;
    private final Semaphore solveSlots;
    private final int workersPerJob;
    private final Duration taskTimeout;

    @Autowired
    public SweepWorkerPool(SpectrumSolver solver,
                           ConfigValidator validator,
                           ProgressBroadcaster broadcaster,
                           @Qualifier("sweepWorkerExecutor") ExecutorService workers,
                           @Qualifier("solverCallExecutor") ExecutorService solverCalls,
                           Semaphore solveSlots,
                           PhotonLabProperties properties) {
        this(solver, validator, broadcaster, workers, solverCalls, solveSlots,
                properties.getSweep().resolvedWorkersPerJob(), properties.getSweep().getTaskTimeout());
    }

    public SweepWorkerPool(SpectrumSolver solver,
                           ConfigValidator validator,
                           ProgressBroadcaster broadcaster,
                           ExecutorService workers,
                           ExecutorService solverCalls,
                           Semaphore solveSlots,
                           int workersPerJob,
                           Duration taskTimeout) {
        this.solver = solver;
        this.validator = validator;
        this.broadcaster = broadcaster;
        this.workers = workers;
        this.solverCalls = solverCalls;
        this.solveSlots = solveSlots;
        this.workersPerJob = Math.max(1, workersPerJob);
        this.taskTimeout = taskTimeout == null ? Duration.ZERO : taskTimeout;
    }

    public int workersPerJob() {
        return workersPerJob;
    }

    /**
     * Starts the worker loops and returns without waiting for any simulation.
     */
    public void launch(SweepJob job, List<SimulationConfig> configs) {
        if (configs.size() != job.total()) {
            throw new IllegalArgumentException("job " + job.id() + " expects " + job.total() + " configurations, got " + configs.size());
        }
        int wanted = Math.min(workersPerJob, configs.size());
        job.assignWorkers(wanted);

        for (int i = 0; i < wanted; i++) {
            try {
                workers.execute(() -> workLoop(job, configs));
            } catch (RejectedExecutionException e) {
                if (i == 0) {
                    log.error("job {}: no worker could be scheduled", job.id(), e);
                    broadcaster.publish(job.abort("No worker available: " + e.getMessage()));
                    return;
                }
                log.warn("job {}: running with {} of {} workers", job.id(), i, wanted);
                job.assignWorkers(i);
                return;
            }
        }
        log.debug("job {}: {} worker(s) for {} configuration(s)", job.id(), wanted, configs.size());
    }

    private void workLoop(SweepJob job, List<SimulationConfig> configs) {
        SweepJob.Claim claim;
        while ((claim = job.claimNext()) != null) {
            if (claim.started()) {
                log.info("job {} running ({} simulations)", job.id(), job.total());
                broadcaster.publish(job.snapshot());
            }
            if (!runSlot(job, claim.index(), configs.get(claim.index()))) return;
        }
    }

    /**
     * @return false when the worker was interrupted and must stop
     */
    private boolean runSlot(SweepJob job, int index, SimulationConfig config) {
        ValidationResult validation = validator.validate(config);
        if (!validation.valid()) {
            String reason = "Invalid configuration: " + describe(validation);
            log.warn("job {} slot {}: {}", job.id(), index, reason);
            publish(job.fail(index, reason, 0L));
            return true;
        }

        try {
            solveSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publish(job.abort("Worker interrupted"));
            return false;
        }
        // cancelled while waiting for a permit: give the slot back without calling the solver
        if (job.isCancelRequested()) {
            solveSlots.release();
            publish(job.discard(index));
            return true;
        }

        // from here solve() owns the permit
        long t0 = System.nanoTime();
        try {
            SimulationResult result = solve(config);
            publish(job.complete(index, result, System.nanoTime() - t0));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publish(job.abort("Worker interrupted"));
            return false;
        } catch (TimeoutException e) {
            String reason = "Simulation timed out after " + taskTimeout.toMillis() + " ms";
            log.warn("job {} slot {}: {}", job.id(), index, reason);
            publish(job.fail(index, reason, System.nanoTime() - t0));
            return true;
        } catch (SolverException e) {
            log.warn("job {} slot {}: {}", job.id(), index, e.getMessage());
            publish(job.fail(index, e.getMessage(), System.nanoTime() - t0));
            return true;
        } catch (RuntimeException e) {
            log.warn("job {} slot {}: unexpected solver failure", job.id(), index, e);
            publish(job.fail(index, e.toString(), System.nanoTime() - t0));
            return true;
        }
    }

    /**
     * Runs one solver call and releases the caller's {@code solveSlots} permit when that call ends.
     * With a timeout the permit follows the call onto {@code solverCalls}, so a solver that ignores
     * interruption keeps its permit until it really returns.
     */
    private SimulationResult solve(SimulationConfig config) throws InterruptedException, TimeoutException {
        if (taskTimeout.isZero() || taskTimeout.isNegative()) {
            try {
                return solver.simulate(config);
            } finally {
                solveSlots.release();
            }
        }

        // whoever flips this first owns the release: the call when it starts, the caller when it gives up first
        AtomicBoolean taken = new AtomicBoolean();
        Future<SimulationResult> call;
        try {
            call = solverCalls.submit(() -> {
                if (!taken.compareAndSet(false, true)) return null;
                try {
                    return solver.simulate(config);
                } finally {
                    solveSlots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            solveSlots.release();
            throw e;
        }

        try {
            return call.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            call.cancel(true);
            if (taken.compareAndSet(false, true)) solveSlots.release();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new SolverException(String.valueOf(cause), cause);
        }
    }

    private void publish(JobSnapshot snapshot) {
        if (snapshot == null) return;
        if (snapshot.isTerminal()) {
            log.info("job {} {}: {}", snapshot.jobId(), snapshot.info().status().wire(), snapshot.info().progress().message());
        }
        broadcaster.publish(snapshot);
    }

    private static String describe(ValidationResult validation) {
        return validation.errors().stream()
                .filter(e -> e.severity() == ValidationError.Severity.ERROR)
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }
}
