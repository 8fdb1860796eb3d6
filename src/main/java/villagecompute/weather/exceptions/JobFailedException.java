/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

import villagecompute.weather.jobs.JobType;

/**
 * Exception thrown by the job dispatcher when a handler fails.
 *
 * <p>
 * Extends RuntimeException per project standards. Scheduled triggers log it and wait for the next cadence; manual
 * triggers map it to HTTP 500, or 503 when the cause is a {@link WarehouseUnavailableException}.
 */
public class JobFailedException extends RuntimeException {

    private final JobType jobType;

    public JobFailedException(JobType jobType, long jobId, Throwable cause) {
        super("Job " + jobId + " (type: " + jobType + ") failed: " + cause.getMessage(), cause);
        this.jobType = jobType;
    }

    public JobType getJobType() {
        return jobType;
    }
}
