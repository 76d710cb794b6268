package io.jobkeeper.core;

/**
 * Base type of scheduler failures surfaced to callers.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
