package io.jobkeeper.core;

/**
 * Durable storage could not be reached. The operation may be retried later.
 */
public class StoreUnavailableException extends SchedulerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
