package io.jobkeeper.core;

import java.time.Duration;
import java.time.Instant;

/**
 * One dispatched (or skipped) run of a job. Created at dispatch, finalized once at completion.
 */
public record ExecutionRecord(
        String executionId,
        String jobId,
        Instant fireTime,
        Instant startedAt,
        Instant finishedAt,
        ExecutionOutcome outcome,
        String error,
        String ownerId
) {

    public boolean isRunning() {
        return outcome == ExecutionOutcome.RUNNING;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public ExecutionRecord finish(Instant finishedAt, ExecutionOutcome outcome, String error) {
        return new ExecutionRecord(executionId, jobId, fireTime, startedAt, finishedAt, outcome, error, ownerId);
    }
}
