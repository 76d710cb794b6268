package io.jobkeeper.core;

import java.time.Instant;

/**
 * Proof that the holder won the right to run a job. Handed back to
 * {@link io.jobkeeper.spi.ExecutionTracker#complete} to finalize the run.
 */
public record ExecutionToken(String executionId, String jobId, Instant fireTime, Instant startedAt) {
}
