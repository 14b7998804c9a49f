package com.photonlab.backend.domain;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SweepJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private static SweepJob job(int total) {
        return new SweepJob("job-1", 1, new SweepConfig(SimulationConfig.defaults(), List.of()), total, 4, CLOCK);
    }

    private static SimulationResult result(double marker) {
        return new SimulationResult(List.of(800.0), List.of(marker), null, null, null, null, SimulationConfig.defaults());
    }

    @Test
    void startsPendingWithQueuedMessage() {
        JobInfo info = job(3).snapshot().info();

        assertThat(info.status()).isEqualTo(JobStatus.PENDING);
        assertThat(info.progress().message()).isEqualTo("Job queued");
        assertThat(info.progress().current()).isZero();
        assertThat(info.startedAt()).isNull();
    }

    @Test
    void firstClaimStartsTheJob() {
        SweepJob job = job(2);

        SweepJob.Claim first = job.claimNext();
        SweepJob.Claim second = job.claimNext();

        assertThat(first).isEqualTo(new SweepJob.Claim(0, true));
        assertThat(second).isEqualTo(new SweepJob.Claim(1, false));
        assertThat(job.claimNext()).isNull();
        assertThat(job.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.snapshot().info().startedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void resultsKeepTheirSlotWhateverTheCompletionOrder() {
        SweepJob job = job(3);
        job.claimNext();
        job.claimNext();
        job.claimNext();

        job.complete(2, result(2), 1_000_000);
        job.complete(0, result(0), 1_000_000);
        JobSnapshot last = job.complete(1, result(1), 1_000_000);

        assertThat(last.info().status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(last.info().progress().percent()).isEqualTo(100.0);
        assertThat(last.info().progress().estimatedRemainingSeconds()).isEqualTo(0.0);
        assertThat(job.results()).extracting(r -> r.transmittance().get(0)).containsExactly(0.0, 1.0, 2.0);
    }

    @Test
    void progressCarriesCountAndEstimate() {
        SweepJob job = job(4);
        job.assignWorkers(2);
        job.claimNext();

        JobSnapshot s = job.complete(0, result(0), 2_000_000_000L);

        assertThat(s.info().progress().current()).isEqualTo(1);
        assertThat(s.info().progress().percent()).isEqualTo(25.0);
        assertThat(s.info().progress().message()).isEqualTo("Completed 1/4 simulations");
        // 2 s average, 3 remaining, 2 workers
        assertThat(s.info().progress().estimatedRemainingSeconds()).isEqualTo(3.0);
    }

    @Test
    void partialFailureStillCompletes() {
        SweepJob job = job(2);
        job.claimNext();
        job.claimNext();

        job.fail(1, "solver exploded", 0);
        JobSnapshot done = job.complete(0, result(0), 0);

        assertThat(done.info().status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.info().progress().message()).isEqualTo("Completed with 1 failed simulation(s)");
        assertThat(done.info().failedSlots()).containsExactly(new SlotFailure(1, "solver exploded"));
        assertThat(job.results().get(1)).isNull();
    }

    @Test
    void allSlotsFailingFailsTheJob() {
        SweepJob job = job(2);
        job.claimNext();
        job.claimNext();

        job.fail(1, "second", 0);
        JobSnapshot done = job.fail(0, "first", 0);

        assertThat(done.info().status()).isEqualTo(JobStatus.FAILED);
        assertThat(done.info().error()).isEqualTo("All 2 simulations failed; first error: first");
        assertThat(done.info().finishedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void cancelWaitsForInFlightWorkAndDiscardsIt() {
        SweepJob job = job(5);
        job.claimNext();
        job.claimNext();

        JobSnapshot cancelling = job.requestCancel();
        assertThat(cancelling.info().status()).isEqualTo(JobStatus.RUNNING);
        assertThat(cancelling.info().progress().message()).isEqualTo("Cancelling; waiting for 2 running simulation(s)");
        assertThat(job.claimNext()).isNull();

        assertThat(job.complete(0, result(0), 0)).isNull();
        JobSnapshot cancelled = job.complete(1, result(1), 0);

        assertThat(cancelled.info().status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.info().progress().message()).isEqualTo("Cancelled after 0/5 simulations");
        assertThat(job.results()).containsOnlyNulls();
    }

    @Test
    void discardingTheLastClaimedSlotFinishesTheCancel() {
        SweepJob job = job(2);
        job.claimNext();

        assertThatThrownBy(() -> job.discard(0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("discarded without a cancel");

        job.requestCancel();
        JobSnapshot cancelled = job.discard(0);

        assertThat(cancelled.info().status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.info().failedSlots()).isNull();
        assertThat(job.results()).containsOnlyNulls();
    }

    @Test
    void cancelBeforeAnyClaimIsImmediate() {
        SweepJob job = job(3);

        JobSnapshot s = job.requestCancel();

        assertThat(s.info().status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.claimNext()).isNull();
    }

    @Test
    void terminalStatesAreFinal() {
        SweepJob job = job(1);
        job.claimNext();
        JobSnapshot done = job.complete(0, result(0), 0);

        JobSnapshot afterCancel = job.requestCancel();
        JobSnapshot afterAbort = job.abort("late");

        assertThat(afterCancel).isEqualTo(done);
        assertThat(afterAbort.info().status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(afterAbort.version()).isEqualTo(done.version());
    }

    @Test
    void versionsIncreaseWithEveryChange() {
        SweepJob job = job(2);
        long v0 = job.snapshot().version();
        job.claimNext();
        long v1 = job.snapshot().version();
        JobSnapshot v2 = job.complete(0, result(0), 0);

        assertThat(v1).isGreaterThan(v0);
        assertThat(v2.version()).isGreaterThan(v1);
    }

    @Test
    void rejectsEmptyJobs() {
        assertThatThrownBy(() -> job(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
