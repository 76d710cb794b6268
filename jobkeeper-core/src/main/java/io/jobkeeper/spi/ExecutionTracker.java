package io.jobkeeper.spi;

import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records executions and guarantees at most one running execution per job id.
 */
public interface ExecutionTracker {

    /**
     * Atomically claims the running slot of a job and creates its RUNNING record.
     *
     * <p>Exactly one of any number of concurrent callers for the same job id receives a token;
     * the others receive an empty result and no record is created for them.
     *
     * @return the token, or empty when a run of the job is already in progress
     */
    Optional<ExecutionToken> tryBegin(String jobId, Instant fireTime);

    /**
     * Finalizes the record of {@code token} and releases the running slot.
     *
     * <p>Idempotent: completing an already finalized token returns the existing record unchanged.
     */
    ExecutionRecord complete(ExecutionToken token, ExecutionOutcome outcome, String error);

    /**
     * Writes a finalized SKIPPED_DUPLICATE record for a fire time that was not run.
     */
    ExecutionRecord recordSkipped(String jobId, Instant fireTime);

    Optional<ExecutionRecord> findRunning(String jobId);

    Optional<ExecutionRecord> findById(String executionId);

    /**
     * Most recent records of a job, newest first.
     */
    List<ExecutionRecord> history(String jobId, int limit);

    Optional<ExecutionRecord> lastCompleted(String jobId, ExecutionOutcome outcome);

    /**
     * Deletes the finalized records of a job.
     *
     * @return number of deleted records
     */
    long deleteHistory(String jobId);

    /**
     * Refreshes the heartbeat of every RUNNING record owned by {@code ownerId}, proving the
     * owning scheduler instance is still alive.
     *
     * @return number of refreshed records
     */
    int heartbeat(String ownerId, Instant now);

    /**
     * Finalizes RUNNING records of other scheduler instances as FAILED and releases their
     * running slots, but only those whose last heartbeat is older than {@code staleAfter}.
     * Runs of a live instance keep their slot no matter how long they take.
     *
     * @return number of recovered records
     */
    int recoverInterrupted(String ownerId, Instant now, Duration staleAfter);
}
