package com.photonlab.backend.api;

import com.photonlab.backend.domain.JobInfo;
import com.photonlab.backend.service.ProgressListener;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Forwards job snapshots to a browser as {@code progress} server-sent events.
 */
public class SseProgressListener implements ProgressListener {

    static final String EVENT = "progress";

    private final SseEmitter emitter;

    public SseProgressListener(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onUpdate(JobInfo info) throws IOException {
        emitter.send(SseEmitter.event()
                .name(EVENT)
                .id(info.jobId())
                .data(info, MediaType.APPLICATION_JSON));
    }

    @Override
    public void onComplete() {
        emitter.complete();
    }

    @Override
    public void onError(Throwable error) {
        emitter.completeWithError(error);
    }
}
