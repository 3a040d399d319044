package com.planforge.jobs.handler;

import com.planforge.common.cancel.CancellationToken;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobType;

/**
 * Processes one claimed job. Handlers report what happened; writing the outcome back to the queue is
 * the worker's job.
 */
public interface JobHandler {

    JobType type();

    JobOutcome processJob(JobEntity job, CancellationToken cancellationToken);

    /**
     * Called once the queue has failed the job for good after a failure the handler reported as
     * retryable, so no further {@link #processJob} call will follow.
     */
    default void onRetriesExhausted(JobEntity job) {
    }
}
