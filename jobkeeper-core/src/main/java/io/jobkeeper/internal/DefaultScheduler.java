package io.jobkeeper.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.ExecutionListener;
import io.jobkeeper.JobBuilder;
import io.jobkeeper.Scheduler;
import io.jobkeeper.config.SchedulerProperties;
import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.JobBusyException;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.core.JobNotFoundException;
import io.jobkeeper.core.JobSpec;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleKind;
import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.core.SchedulerStatus;
import io.jobkeeper.spi.ExecutionTracker;
import io.jobkeeper.spi.JobStore;
import io.jobkeeper.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Scheduler} over a {@link JobStore} and an {@link ExecutionTracker}.
 *
 * <p>Registration and management calls write definitions and schedule state directly to the
 * store; the loop picks the changes up on its next tick.
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };
    private static final int STATE_WRITE_ATTEMPTS = 5;

    private final JobStore jobStore;
    private final ExecutionTracker tracker;
    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SchedulerLoop loop;
    private final LifecycleGuard guard;

    public DefaultScheduler(SchedulerProperties props,
                            JobStore jobStore,
                            ExecutionTracker tracker,
                            JobHandlerRegistry registry,
                            ObjectMapper objectMapper,
                            List<ExecutionListener> listeners) {
        this(props, jobStore, tracker, registry, objectMapper, listeners, Clock.systemUTC());
    }

    public DefaultScheduler(SchedulerProperties props,
                            JobStore jobStore,
                            ExecutionTracker tracker,
                            JobHandlerRegistry registry,
                            ObjectMapper objectMapper,
                            List<ExecutionListener> listeners,
                            Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.loop = new SchedulerLoop(props, jobStore, tracker, registry, objectMapper, listeners, clock);
        this.guard = new LifecycleGuard(props, jobStore, tracker, loop, clock);
    }

    @Override
    public void start() {
        guard.start();
    }

    @Override
    public boolean stop() {
        return guard.stop();
    }

    @Override
    public boolean stop(Duration gracePeriod) {
        return guard.stop(gracePeriod);
    }

    @Override
    public boolean isRunning() {
        return guard.isRunning();
    }

    @Override
    public SchedulerStatus status() {
        return loop.status();
    }

    @Override
    public <T> JobBuilder create(String handler, T data) {
        return new SimpleJobBuilder(handler, toData(data), clock, this::register);
    }

    @Override
    public JobBuilder create(String handler) {
        return new SimpleJobBuilder(handler, null, clock, this::register);
    }

    JobDefinition register(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (!registry.contains(spec.handler())) {
            throw new IllegalArgumentException("No JobHandler registered for name: " + spec.handler()
                    + ", known handlers: " + registry.names());
        }

        Instant now = now();
        Optional<JobDefinition> existing = jobStore.get(spec.id());

        JobDefinition saved;
        Instant first;
        if (existing.isPresent()) {
            if (!spec.replaceExisting()) {
                throw new ConflictException(spec.id(), "job already exists: " + spec.id());
            }
            JobDefinition current = existing.get();
            Optional<ScheduleState> previous = jobStore.loadScheduleState(spec.id());
            boolean keepTiming = sameTiming(current.schedule(), spec.schedule())
                    && current.enabled() == spec.enabled()
                    && previous.map(ScheduleState::nextFireTime).isPresent()
                    && !spec.runImmediately();
            ScheduleSpec schedule = keepTiming ? current.schedule() : spec.schedule();

            saved = jobStore.update(spec.id(), JobUpdate.builder()
                    .handler(spec.handler())
                    .data(spec.data() != null ? spec.data() : Map.of())
                    .schedule(schedule)
                    .enabled(spec.enabled())
                    .expectedVersion(current.version())
                    .build());
            if (keepTiming) {
                // the loop keeps advancing the stored state, so it is left as it is
                first = previous.get().nextFireTime();
            } else {
                first = firstFireTime(saved, spec.runImmediately(), now);
                writeNextFireTime(saved.id(), first);
            }
        } else {
            saved = new JobDefinition(spec.id(), spec.handler(), spec.data(), spec.schedule(), spec.enabled(),
                    now, now, 0L);
            jobStore.add(saved);
            first = firstFireTime(saved, spec.runImmediately(), now);
            jobStore.saveScheduleState(saved.id(), ScheduleState.initial(first));
        }

        log.info("jobkeeper registered job id={} handler={} schedule={} enabled={} nextFireTime={}",
                saved.id(), saved.handler(), saved.schedule(), saved.enabled(), first);
        return saved;
    }

    @Override
    public JobDefinition update(String id, JobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.handler() != null && !registry.contains(update.handler())) {
            throw new IllegalArgumentException("No JobHandler registered for name: " + update.handler());
        }
        JobDefinition updated = jobStore.update(id, update);
        if (update.changesTiming()) {
            reschedule(updated);
        }
        log.info("jobkeeper updated job id={} version={}", id, updated.version());
        return updated;
    }

    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        boolean removed = jobStore.remove(id);
        if (removed) {
            long deleted = tracker.deleteHistory(id);
            log.info("jobkeeper removed job id={} deletedHistory={}", id, deleted);
        }
        return removed;
    }

    @Override
    public JobDefinition enable(String id) {
        return update(id, JobUpdate.builder().enabled(true).build());
    }

    @Override
    public JobDefinition disable(String id) {
        return update(id, JobUpdate.builder().enabled(false).build());
    }

    @Override
    public void runNow(String id) {
        JobDefinition job = jobStore.get(id).orElseThrow(() -> new JobNotFoundException(id));
        if (!job.enabled()) {
            throw new IllegalStateException("Job is disabled: " + id);
        }
        if (tracker.findRunning(id).isPresent()) {
            throw new JobBusyException(id);
        }
        writeNextFireTime(id, now());
        log.info("jobkeeper job triggered manually id={}", id);
    }

    @Override
    public Optional<JobDefinition> get(String id) {
        return jobStore.get(id);
    }

    @Override
    public List<JobDefinition> list(JobFilter filter) {
        return jobStore.list(filter != null ? filter : JobFilter.all());
    }

    @Override
    public Optional<ScheduleState> state(String id) {
        return jobStore.loadScheduleState(id);
    }

    @Override
    public List<ExecutionRecord> history(String id, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return tracker.history(id, limit);
    }

    private void reschedule(JobDefinition job) {
        Instant next = firstFireTime(job, false, now());
        writeNextFireTime(job.id(), next);
        log.debug("jobkeeper rescheduled job id={} nextFireTime={}", job.id(), next);
    }

    /**
     * Sets the next fire time with a conditional write on the state that was read, reloading
     * and retrying when the loop advanced the state in between.
     *
     * @throws ConflictException if every attempt lost to a concurrent writer
     */
    private void writeNextFireTime(String id, Instant next) {
        for (int attempt = 1; ; attempt++) {
            Optional<ScheduleState> current = jobStore.loadScheduleState(id);
            if (current.isEmpty()) {
                jobStore.saveScheduleState(id, ScheduleState.initial(next));
                return;
            }
            try {
                jobStore.replaceScheduleState(id, current.get(), current.get().withNextFireTime(next));
                return;
            } catch (ConflictException e) {
                if (attempt >= STATE_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("jobkeeper schedule state changed concurrently, retrying id={} attempt={}", id, attempt);
            }
        }
    }

    private static Instant firstFireTime(JobDefinition job, boolean runImmediately, Instant now) {
        if (!job.enabled()) {
            return null;
        }
        if (runImmediately) {
            return now;
        }
        return TriggerEvaluator.firstFireTime(job.schedule(), now).orElse(null);
    }

    // The interval anchor defaults to the registration time, so it is not compared.
    private static boolean sameTiming(ScheduleSpec a, ScheduleSpec b) {
        if (a.kind() != b.kind()
                || !Objects.equals(a.expression(), b.expression())
                || !Objects.equals(a.timezone(), b.timezone())
                || !Objects.equals(a.endAt(), b.endAt())) {
            return false;
        }
        return a.kind() == ScheduleKind.INTERVAL || Objects.equals(a.startAt(), b.startAt());
    }

    private Map<String, Object> toData(Object data) {
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(data, DATA_TYPE);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Job data must serialize to a JSON object: " + e.getMessage(), e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
