package com.photonlab.backend.api;

import com.photonlab.backend.api.dto.CancelResponse;
import com.photonlab.backend.api.dto.JobResults;
import com.photonlab.backend.api.dto.SweepStartResponse;
import com.photonlab.backend.domain.JobInfo;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepPreview;
import com.photonlab.backend.service.ProgressBroadcaster;
import com.photonlab.backend.service.SweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

@RestController
@RequestMapping("/api/v1/sweeps")
public class SweepController {

    private static final Logger log = LoggerFactory.getLogger(SweepController.class);
    private static final long STREAM_TIMEOUT_MS = Duration.ofHours(2).toMillis();

    private final SweepService sweeps;

    public SweepController(SweepService sweeps) {
        this.sweeps = sweeps;
    }

    @PostMapping("/preview")
    public SweepPreview preview(@RequestBody SweepConfig body) {
        return sweeps.preview(body);
    }

    @PostMapping
    public ResponseEntity<SweepStartResponse> start(@RequestBody SweepConfig body) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(sweeps.startSweep(body));
    }

    @GetMapping("/{id}")
    public JobInfo status(@PathVariable String id) {
        return sweeps.getStatus(id);
    }

    @GetMapping("/{id}/results")
    public JobResults results(@PathVariable String id) {
        return sweeps.getResults(id);
    }

    @PostMapping("/{id}/cancel")
    public CancelResponse cancel(@PathVariable String id) {
        return sweeps.cancelSweep(id);
    }

    /**
     * One {@code progress} event per change; the stream ends after the terminal snapshot.
     */
    // SseEmitter sets text/event-stream itself; errors stay JSON
    @GetMapping("/{id}/progress")
    public SseEmitter progress(@PathVariable String id) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        AtomicReference<ProgressBroadcaster.Subscription> subscription = new AtomicReference<>();
        Runnable detach = () -> {
            ProgressBroadcaster.Subscription s = subscription.getAndSet(null);
            if (s != null) s.cancel();
        };
        emitter.onCompletion(detach);
        emitter.onTimeout(() -> {
            log.debug("progress stream for job {} timed out", id);
            detach.run();
            emitter.complete();
        });
        emitter.onError(e -> detach.run());

        subscription.set(sweeps.subscribe(id, new SseProgressListener(emitter)));
        return emitter;
    }
}
