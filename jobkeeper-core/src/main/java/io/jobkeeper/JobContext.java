package io.jobkeeper;

import java.time.Instant;

/**
 * Metadata of the run a handler is executing.
 *
 * @param lastSuccessAt start time of the previous successful run of the same job, or null
 */
public record JobContext(
        String jobId,
        String executionId,
        Instant fireTime,
        Instant startedAt,
        Instant lastSuccessAt
) {
}
