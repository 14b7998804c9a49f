package com.photonlab.backend.api;

import com.photonlab.backend.api.dto.CleanupResponse;
import com.photonlab.backend.domain.JobInfo;
import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.service.SweepService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final SweepService sweeps;

    public JobController(SweepService sweeps) {
        this.sweeps = sweeps;
    }

    @GetMapping
    public Map<String, Object> list(@RequestParam(required = false) String status,
                                    @RequestParam(defaultValue = "50") int limit,
                                    @RequestParam(defaultValue = "0") int offset) {
        JobStatus filter = JobStatus.fromWire(status);
        List<JobInfo> jobs = sweeps.list(filter, limit, offset);
        return Map.of("jobs", jobs, "count", jobs.size());
    }

    @GetMapping("/{id}")
    public JobInfo get(@PathVariable String id) {
        return sweeps.getStatus(id);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        sweeps.delete(id);
        return Map.of("ok", true, "job_id", id);
    }

    @PostMapping("/cleanup")
    public CleanupResponse cleanup(@RequestParam(required = false) Integer days) {
        return sweeps.cleanup(days);
    }
}
