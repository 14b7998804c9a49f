package com.photonlab.backend.service;

import com.photonlab.backend.domain.JobSnapshot;
import com.photonlab.backend.domain.SweepJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-job fan-out of progress snapshots. Best effort: snapshots older than the last one delivered are
 * dropped, and a subscriber that missed something can always re-read the job.
 *
 * <p>{@link #publish} only parks the snapshot and schedules delivery on the {@code delivery} executor, so
 * workers never wait for a slow subscriber. Each job drains on at most one delivery task at a time, and a
 * burst of snapshots published while a subscriber is busy collapses to the newest one.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final Executor delivery;

    /**
     * Delivers on the publishing thread.
     */
    public ProgressBroadcaster() {
        this(Runnable::run);
    }

    @Autowired
    public ProgressBroadcaster(@Qualifier("progressDeliveryExecutor") Executor delivery) {
        this.delivery = delivery;
    }

    /**
     * Registers a listener and immediately hands it the job's current state. If the job has already
     * finished the listener is completed right away.
     */
    public Subscription subscribe(SweepJob job, ProgressListener listener) {
        while (true) {
            Channel channel = channels.computeIfAbsent(job.id(), Channel::new);
            synchronized (channel) {
                // closed channels are already unmapped; the next pass creates a fresh one
                if (channel.closed) continue;

                JobSnapshot current = job.snapshot();
                channel.lastVersion = Math.max(channel.lastVersion, current.version());
                boolean delivered = deliver(listener, current);
                if (delivered && !current.isTerminal()) {
                    channel.listeners.add(listener);
                    return () -> unsubscribe(job.id(), listener);
                }
                if (delivered) listener.onComplete();
                if (channel.listeners.isEmpty() && current.isTerminal()) {
                    channel.closed = true;
                    channels.remove(job.id(), channel);
                }
                return () -> {};
            }
        }
    }

    public void publish(JobSnapshot snapshot) {
        if (snapshot == null) return;
        Channel channel = channels.get(snapshot.jobId());
        if (channel == null) return;

        channel.pending.accumulateAndGet(snapshot,
                (parked, offered) -> parked == null || offered.version() > parked.version() ? offered : parked);
        if (!channel.scheduled.compareAndSet(false, true)) return;
        try {
            delivery.execute(() -> drain(channel));
        } catch (RejectedExecutionException e) {
            log.debug("progress delivery executor rejected job {}; delivering inline", snapshot.jobId());
            drain(channel);
        }
    }

    private void drain(Channel channel) {
        synchronized (channel) {
            // cleared before taking, so a snapshot parked after this point schedules another drain
            channel.scheduled.set(false);
            JobSnapshot snapshot = channel.pending.getAndSet(null);
            if (snapshot == null || channel.closed || snapshot.version() <= channel.lastVersion) return;
            channel.lastVersion = snapshot.version();

            List<ProgressListener> dead = new ArrayList<>();
            for (ProgressListener l : channel.listeners) {
                if (!deliver(l, snapshot)) dead.add(l);
            }
            channel.listeners.removeAll(dead);

            if (snapshot.isTerminal()) {
                channel.closed = true;
                for (ProgressListener l : channel.listeners) l.onComplete();
                channel.listeners.clear();
                channels.remove(snapshot.jobId(), channel);
            }
        }
    }

    public void unsubscribe(String jobId, ProgressListener listener) {
        Channel channel = channels.get(jobId);
        if (channel == null) return;
        synchronized (channel) {
            channel.listeners.remove(listener);
        }
    }

    public int subscriberCount(String jobId) {
        Channel channel = channels.get(jobId);
        return channel == null ? 0 : channel.listeners.size();
    }

    private boolean deliver(ProgressListener listener, JobSnapshot snapshot) {
        try {
            listener.onUpdate(snapshot.info());
            return true;
        } catch (Exception e) {
            log.debug("dropping progress subscriber of job {}: {}", snapshot.jobId(), e.toString());
            listener.onError(e);
            return false;
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private static final class Channel {
        final String jobId;
        final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
        final AtomicReference<JobSnapshot> pending = new AtomicReference<>();
        final AtomicBoolean scheduled = new AtomicBoolean();
        long lastVersion = -1;
        boolean closed;

        Channel(String jobId) {
            this.jobId = jobId;
        }
    }
}
