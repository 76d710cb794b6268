package io.jobkeeper.core;

/**
 * A store write collided with a concurrent writer of the same job. Reload and retry.
 */
public class ConflictException extends SchedulerException {

    private final String jobId;

    public ConflictException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
