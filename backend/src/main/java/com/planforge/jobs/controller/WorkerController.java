package com.planforge.jobs.controller;

import com.planforge.jobs.dto.JobResponse;
import com.planforge.jobs.dto.JobStatsResponse;
import com.planforge.jobs.dto.WorkerHealthResponse;
import com.planforge.jobs.service.JobStore;
import com.planforge.jobs.worker.JobWorker;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;

/**
 * Operator view of the queue. Restricted to the OPERATOR role in the security chain.
 */
@RestController
@RequestMapping("/v1/worker")
@Validated
public class WorkerController {

    private final ObjectProvider<JobWorker> jobWorker;
    private final JobStore jobStore;

    public WorkerController(ObjectProvider<JobWorker> jobWorker, JobStore jobStore) {
        this.jobWorker = jobWorker;
        this.jobStore = jobStore;
    }

    @GetMapping("/health")
    public WorkerHealthResponse health() {
        JobWorker worker = jobWorker.getIfAvailable();
        if (worker == null) {
            return WorkerHealthResponse.disabled();
        }
        return new WorkerHealthResponse(true, worker.state(), worker.inFlight(), worker.stats());
    }

    @GetMapping("/jobs/stats")
    public JobStatsResponse jobStats(@RequestParam(value = "hours", defaultValue = "24") @Min(1) @Max(720) int hours,
                                     @RequestParam(value = "failures", defaultValue = "20") @Min(1) @Max(200) int failures) {
        Instant since = Instant.now().minus(Duration.ofHours(hours));
        return new JobStatsResponse(
                jobStore.stats(since),
                jobStore.findFailed(failures).stream().map(JobResponse::from).toList()
        );
    }
}
