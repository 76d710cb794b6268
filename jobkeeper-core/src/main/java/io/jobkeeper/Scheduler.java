package io.jobkeeper;

import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.core.SchedulerStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs are persisted definitions that point at a registered {@link JobHandler} by name.
 * At most one run of a job is in progress at any time; a fire time that comes due while the
 * previous run is still going is recorded as skipped.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.create("reddit-scrape")
 *          .dailyAt("08:00")
 *          .timezone("America/Chicago")
 *          .replaceExisting()
 *          .save();
 *
 * scheduler.create("cache-refresh", Map.of("region", "us"))
 *          .id("cache-refresh-us")
 *          .every("5 minutes")
 *          .save();
 *
 * scheduler.stop(Duration.ofSeconds(10));
 * }</pre>
 */
public interface Scheduler {
    /**
     * Start polling and executing due jobs. Idempotent.
     */
    void start();

    /**
     * Stop using the configured shutdown grace period.
     */
    boolean stop();

    /**
     * Stop dispatching, then wait up to {@code gracePeriod} for running jobs. Idempotent.
     *
     * @return true if every running job finished within the grace period
     */
    boolean stop(Duration gracePeriod);

    boolean isRunning();

    SchedulerStatus status();

    /**
     * Create a job builder. Nothing is persisted until {@code save()} is called.
     * The job id defaults to the handler name.
     */
    <T> JobBuilder create(String handler, T data);

    JobBuilder create(String handler);

    JobDefinition update(String id, JobUpdate update);

    boolean remove(String id);

    JobDefinition enable(String id);

    JobDefinition disable(String id);

    /**
     * Make the job due immediately; it runs on the next tick.
     *
     * @throws io.jobkeeper.core.JobBusyException if a run of the job is in progress
     */
    void runNow(String id);

    Optional<JobDefinition> get(String id);

    List<JobDefinition> list(JobFilter filter);

    Optional<ScheduleState> state(String id);

    /**
     * Most recent executions of a job, newest first.
     */
    List<ExecutionRecord> history(String id, int limit);
}
