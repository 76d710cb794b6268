package io.jobkeeper.core;

/**
 * A run of the job is already in progress.
 */
public class JobBusyException extends SchedulerException {

    private final String jobId;

    public JobBusyException(String jobId) {
        super("job is already running: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
