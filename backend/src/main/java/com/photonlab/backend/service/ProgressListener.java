package com.photonlab.backend.service;

import com.photonlab.backend.domain.JobInfo;

/**
 * Receives job snapshots from {@link ProgressBroadcaster}. Calls for one job never overlap.
 */
public interface ProgressListener {

    /**
     * @throws Exception if delivery failed; the listener is then dropped
     */
    void onUpdate(JobInfo info) throws Exception;

    /** The job reached a terminal state; no further updates follow. */
    default void onComplete() {}

    /** Delivery failed and the subscription was dropped. */
    default void onError(Throwable error) {}
}
