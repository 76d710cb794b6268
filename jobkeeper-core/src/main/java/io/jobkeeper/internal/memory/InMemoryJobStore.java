package io.jobkeeper.internal.memory;

import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.DueJob;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobNotFoundException;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.spi.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobStore}. Nothing survives a restart; meant for tests and for hosts
 * that run without a database.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, JobDefinition> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScheduleState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String add(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new ConflictException(job.id(), "job already exists: " + job.id());
        }
        return job.id();
    }

    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        states.remove(id);
        return jobs.remove(id) != null;
    }

    @Override
    public JobDefinition update(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");

        JobDefinition current = jobs.get(id);
        if (current == null) {
            throw new JobNotFoundException(id);
        }
        if (update.expectedVersion() != null && update.expectedVersion() != current.version()) {
            throw new ConflictException(id, "stale version " + update.expectedVersion()
                    + " for job " + id + ", current is " + current.version());
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        JobDefinition next = update.applyTo(current).withVersion(current.version() + 1, now);
        if (!jobs.replace(id, current, next)) {
            throw new ConflictException(id, "job was modified concurrently: " + id);
        }
        return next;
    }

    @Override
    public Optional<JobDefinition> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<JobDefinition> list(JobFilter filter) {
        JobFilter f = filter != null ? filter : JobFilter.all();
        return jobs.values().stream()
                .filter(f::matches)
                .sorted(Comparator.comparing(JobDefinition::id))
                .limit(Math.max(0, f.limit()))
                .toList();
    }

    @Override
    public Optional<ScheduleState> loadScheduleState(String id) {
        return Optional.ofNullable(states.get(id));
    }

    @Override
    public void saveScheduleState(String id, ScheduleState state) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(state, "state must not be null");
        states.put(id, state);
    }

    @Override
    public void replaceScheduleState(String id, ScheduleState expected, ScheduleState next) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");
        if (!states.replace(id, expected, next)) {
            throw new ConflictException(id, "schedule state of job " + id + " was modified concurrently");
        }
    }

    @Override
    public List<DueJob> findDue(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        List<DueJob> due = new ArrayList<>();
        for (var e : states.entrySet()) {
            if (!e.getValue().isDue(now)) {
                continue;
            }
            JobDefinition job = jobs.get(e.getKey());
            if (job != null && job.enabled()) {
                due.add(new DueJob(job, e.getValue()));
            }
        }
        // the most overdue jobs win when there are more than limit, dispatch order is by id
        return due.stream()
                .sorted(Comparator.comparing((DueJob d) -> d.state().nextFireTime()).thenComparing(DueJob::id))
                .limit(Math.max(0, limit))
                .sorted(Comparator.comparing(DueJob::id))
                .toList();
    }
}
