package io.jobkeeper.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Structured event emitted for every completed or skipped execution.
 */
public record ExecutionEvent(
        String jobId,
        String executionId,
        Instant fireTime,
        ExecutionOutcome outcome,
        Duration duration,
        String error
) {

    public static ExecutionEvent of(ExecutionRecord record) {
        return new ExecutionEvent(
                record.jobId(),
                record.executionId(),
                record.fireTime(),
                record.outcome(),
                record.duration(),
                record.error()
        );
    }
}
