package io.jobkeeper.core;

public class JobNotFoundException extends SchedulerException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("no job with id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
