package io.jobkeeper.core;

/**
 * The scheduler could not be started, typically because the job store failed to initialize.
 */
public class SchedulerStartupException extends SchedulerException {

    public SchedulerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
