package io.jobkeeper.spi;

import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.DueJob;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobNotFoundException;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.core.StoreUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of job definitions and their schedule state.
 *
 * <p>Every mutation is durable before the call returns. Implementations throw
 * {@link StoreUnavailableException} when the backing storage cannot be reached.
 */
public interface JobStore {

    /**
     * Verifies the backing storage is reachable. Called once at scheduler startup.
     */
    default void initialize() {
    }

    /**
     * Insert a new definition.
     *
     * @throws ConflictException if a job with the same id already exists
     */
    String add(JobDefinition job);

    /**
     * Delete a definition together with its schedule state. A running marker held by the
     * {@link ExecutionTracker} on the same job id survives until that run completes.
     *
     * @return true if a definition was deleted
     */
    boolean remove(String id);

    /**
     * Apply a partial update using compare-and-swap on the definition version.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws ConflictException if the row changed concurrently or {@code expectedVersion} is stale
     */
    JobDefinition update(String id, JobUpdate update);

    Optional<JobDefinition> get(String id);

    /**
     * Definitions matching the filter, ordered by id.
     */
    List<JobDefinition> list(JobFilter filter);

    Optional<ScheduleState> loadScheduleState(String id);

    /**
     * Creates or overwrites the schedule state of a job. Used when a job is first registered.
     */
    void saveScheduleState(String id, ScheduleState state);

    /**
     * Replaces the schedule state only if the stored state still equals {@code expected}.
     * Never creates a state row, so a job removed in the meantime stays removed.
     *
     * @throws ConflictException if the stored state differs from {@code expected} or is absent
     */
    void replaceScheduleState(String id, ScheduleState expected, ScheduleState next);

    /**
     * Enabled jobs whose next fire time is at or before {@code now}, ordered by id.
     */
    List<DueJob> findDue(Instant now, int limit);
}
