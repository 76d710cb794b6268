package io.jobkeeper.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.ExecutionListener;
import io.jobkeeper.config.SchedulerProperties;
import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.DueJob;
import io.jobkeeper.core.ExecutionEvent;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.core.SchedulerStatus;
import io.jobkeeper.core.StoreUnavailableException;
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
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic tick that finds due jobs, dispatches them onto a bounded worker pool and
 * persists their outcomes.
 *
 * <p>A single loop thread owns all schedule state writes. Workers only run job bodies; their
 * outcomes are queued and written by the loop at the start of the next tick. Once the loop has
 * stopped, outcomes are written inline by the worker that produced them.
 */
public class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    static final String ABNORMAL_TERMINATION = "job body terminated abnormally";
    static final String REJECTED_ON_STOP = "rejected: scheduler is stopping";

    private final SchedulerProperties props;
    private final String ownerId;
    private final JobStore jobStore;
    private final ExecutionTracker tracker;
    private final JobInvoker invoker;
    private final List<ExecutionListener> listeners;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean persistInline = new AtomicBoolean(false);
    private final Queue<Completion> completions = new ConcurrentLinkedQueue<>();
    private final Map<String, ExecutionToken> inFlight = new ConcurrentHashMap<>();
    private final Object tickLock = new Object();

    private volatile Semaphore permits;
    private volatile ExecutorService workerPool;
    private volatile Thread loopThread;
    private volatile CountDownLatch stopSignal;
    private volatile Instant lastTickAt;
    private Instant nextMaintenanceAt;
    private int skippedTicks;

    private record Completion(ExecutionToken token, ExecutionOutcome outcome, String error) {
    }

    public SchedulerLoop(SchedulerProperties props,
                         JobStore jobStore,
                         ExecutionTracker tracker,
                         JobHandlerRegistry registry,
                         ObjectMapper objectMapper,
                         List<ExecutionListener> listeners,
                         Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.ownerId = props.resolveOwnerId();
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.invoker = new JobInvoker(registry, tracker, objectMapper);
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the loop thread and the worker pool. Idempotent.
     */
    public void start() {
        Duration interval = Objects.requireNonNull(props.getTickInterval(), "jobkeeper.tickInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("jobkeeper.tickInterval must be a positive duration");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("jobkeeper.maxConcurrency must be positive");
        }
        Duration stale = Objects.requireNonNull(props.getStaleRunTimeout(), "jobkeeper.staleRunTimeout must not be null");
        if (stale.isZero() || stale.isNegative()) {
            throw new IllegalArgumentException("jobkeeper.staleRunTimeout must be a positive duration");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        persistInline.set(false);
        synchronized (tickLock) {
            nextMaintenanceAt = null;
        }
        permits = new Semaphore(props.getMaxConcurrency());
        AtomicInteger workerCount = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("jobkeeper.worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        stopSignal = new CountDownLatch(1);
        loopThread = new Thread(this::runLoop);
        loopThread.setName("jobkeeper.loop");
        loopThread.setDaemon(true);
        loopThread.start();

        if (interval.compareTo(maintenanceInterval()) > 0) {
            log.warn("jobkeeper tickInterval={} is longer than a third of staleRunTimeout={}, other instances may recover runs of this one",
                    interval, stale);
        }
        log.info("jobkeeper loop started ownerId={} tickInterval={} maxConcurrency={} batchSize={}",
                ownerId, interval, props.getMaxConcurrency(), props.getBatchSize());
    }

    /**
     * Stop dispatching, then wait up to {@code gracePeriod} for running job bodies. Job bodies
     * still running after the grace period are left alone; their records stay RUNNING, and keep
     * being heartbeated, until they finish. Idempotent.
     *
     * @return true if no job body was still running when the grace period ended
     */
    public boolean stop(Duration gracePeriod) {
        if (!running.compareAndSet(true, false)) {
            return true;
        }
        Duration grace = (gracePeriod == null || gracePeriod.isNegative()) ? Duration.ZERO : gracePeriod;
        long deadline = System.nanoTime() + grace.toNanos();
        log.info("jobkeeper loop stopping grace={} inFlight={}", grace, inFlight.size());

        stopSignal.countDown();
        ExecutorService pool = workerPool;
        Thread loop = loopThread;
        boolean drained = false;
        try {
            loop.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
            pool.shutdown();
            drained = pool.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (loop.isAlive()) {
            log.warn("jobkeeper loop thread still finishing its tick after grace={}", grace);
        }

        persistInline.set(true);
        drainCompletions(true);

        if (!drained) {
            for (ExecutionToken token : inFlight.values()) {
                log.warn("jobkeeper abandoning running job id={} executionId={} after grace={}",
                        token.jobId(), token.executionId(), grace);
            }
            keepAbandonedRunsAlive();
        }
        log.info("jobkeeper loop stopped drained={}", drained);
        return drained;
    }

    public boolean isRunning() {
        return running.get();
    }

    public String ownerId() {
        return ownerId;
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(running.get(), ownerId, inFlight.size(), lastTickAt);
    }

    private void runLoop() {
        CountDownLatch signal = stopSignal;
        long tickMillis = props.getTickInterval().toMillis();
        while (running.get()) {
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("jobkeeper tick failed msg={}", e.getMessage(), e);
            }
            try {
                if (signal.await(tickMillis, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("jobkeeper loop thread exited");
    }

    /**
     * One evaluation pass: persist queued outcomes, then dispatch every due job that fits in the
     * worker pool.
     */
    void tick() {
        synchronized (tickLock) {
            drainCompletions(false);

            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            lastTickAt = now;
            maintainRuns(now);

            List<DueJob> due;
            try {
                due = jobStore.findDue(now, props.getBatchSize());
            } catch (StoreUnavailableException e) {
                skippedTicks++;
                log.warn("jobkeeper job store unavailable, skipping tick skippedTicks={} msg={}",
                        skippedTicks, e.getMessage());
                return;
            }
            if (skippedTicks > 0) {
                log.info("jobkeeper job store reachable again after skippedTicks={}", skippedTicks);
                skippedTicks = 0;
            }
            if (!due.isEmpty()) {
                log.debug("jobkeeper tick now={} due={}", now, due.size());
            }

            ExecutorService pool = workerPool;
            for (int i = 0; i < due.size(); i++) {
                if (!running.get()) {
                    return;
                }
                DueJob job = due.get(i);
                try {
                    if (!dispatch(job, now, pool)) {
                        log.debug("jobkeeper worker pool saturated, deferring remaining={}", due.size() - i);
                        return;
                    }
                } catch (StoreUnavailableException e) {
                    log.warn("jobkeeper job store unavailable during dispatch id={}, ending tick msg={}",
                            job.id(), e.getMessage());
                    return;
                } catch (RuntimeException e) {
                    log.error("jobkeeper dispatch failed id={} msg={}", job.id(), e.getMessage(), e);
                }
            }
        }
    }

    /**
     * @return false when no worker slot was free and the job was left due
     */
    private boolean dispatch(DueJob due, Instant now, ExecutorService pool) {
        JobDefinition job = due.definition();
        ScheduleState state = due.state();
        Instant fireTime = state.nextFireTime();

        Instant next = evaluateNext(job, now);
        boolean misfired = Duration.between(fireTime, now).compareTo(props.getMisfireThreshold()) > 0;
        int misfires = misfired ? state.misfireCount() + 1 : state.misfireCount();

        Semaphore slots = permits;
        if (!slots.tryAcquire()) {
            return false;
        }

        ExecutionToken token;
        try {
            token = tracker.tryBegin(job.id(), fireTime).orElse(null);
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }

        if (token == null) {
            slots.release();
            ExecutionRecord skipped = tracker.recordSkipped(job.id(), fireTime);
            advance(job.id(), state, new ScheduleState(next, state.lastFireTime(), misfires));
            log.info("jobkeeper skipped job id={} fireTime={} reason=previous run still in progress nextFireTime={}",
                    job.id(), fireTime, next);
            publish(ExecutionEvent.of(skipped));
            return true;
        }

        if (misfired) {
            log.warn("jobkeeper misfire id={} fireTime={} lateness={} misfireCount={}",
                    job.id(), fireTime, Duration.between(fireTime, now), misfires);
        }

        inFlight.put(token.executionId(), token);
        try {
            pool.execute(() -> runJob(job, token, slots));
        } catch (RejectedExecutionException e) {
            inFlight.remove(token.executionId());
            slots.release();
            tracker.complete(token, ExecutionOutcome.FAILED, REJECTED_ON_STOP);
            log.warn("jobkeeper dispatch rejected id={} executionId={}, job stays due", job.id(), token.executionId());
            return false;
        }

        advance(job.id(), state, new ScheduleState(next, now, misfires));
        log.debug("jobkeeper dispatched id={} executionId={} fireTime={} nextFireTime={}",
                job.id(), token.executionId(), fireTime, next);
        if (next == null) {
            log.info("jobkeeper schedule exhausted id={} schedule={}", job.id(), job.schedule());
        }
        return true;
    }

    /**
     * Writes the advanced state unless the job was updated, triggered or removed since it was
     * read as due. The newer write wins and is picked up by the next tick.
     */
    private void advance(String jobId, ScheduleState read, ScheduleState advanced) {
        try {
            jobStore.replaceScheduleState(jobId, read, advanced);
        } catch (ConflictException e) {
            log.debug("jobkeeper schedule state changed during dispatch, keeping the newer state id={}", jobId);
        }
    }

    /**
     * Refreshes the heartbeat of this instance's runs and recovers runs whose owner went silent.
     * Runs at most once per maintenance interval.
     */
    private void maintainRuns(Instant now) {
        if (nextMaintenanceAt != null && now.isBefore(nextMaintenanceAt)) {
            return;
        }
        nextMaintenanceAt = now.plus(maintenanceInterval());
        try {
            if (!inFlight.isEmpty()) {
                tracker.heartbeat(ownerId, now);
            }
            int recovered = tracker.recoverInterrupted(ownerId, now, props.getStaleRunTimeout());
            if (recovered > 0) {
                log.warn("jobkeeper marked stale executions of other instances as failed count={} staleRunTimeout={}",
                        recovered, props.getStaleRunTimeout());
            }
        } catch (StoreUnavailableException e) {
            log.warn("jobkeeper could not maintain running executions msg={}", e.getMessage());
        }
    }

    // A third of the stale timeout, so a live owner misses at least two heartbeats before it looks dead.
    private Duration maintenanceInterval() {
        return props.getStaleRunTimeout().dividedBy(3);
    }

    /**
     * Keeps heartbeating runs left behind by {@link #stop(Duration)} until their completions
     * are persisted, so other instances do not recover them while their bodies still run.
     */
    private void keepAbandonedRunsAlive() {
        long intervalMillis = maintenanceInterval().toMillis();
        Thread keeper = new Thread(() -> {
            while (!inFlight.isEmpty() && !running.get()) {
                try {
                    Thread.sleep(intervalMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                try {
                    tracker.heartbeat(ownerId, clock.instant().truncatedTo(ChronoUnit.MILLIS));
                } catch (StoreUnavailableException e) {
                    log.warn("jobkeeper could not heartbeat abandoned executions msg={}", e.getMessage());
                }
            }
            log.debug("jobkeeper abandoned executions finished, heartbeat stopped");
        });
        keeper.setName("jobkeeper.heartbeat");
        keeper.setDaemon(true);
        keeper.start();
    }

    private Instant evaluateNext(JobDefinition job, Instant now) {
        try {
            return TriggerEvaluator.nextFireTime(job.schedule(), now).orElse(null);
        } catch (IllegalArgumentException e) {
            log.error("jobkeeper invalid schedule id={} schedule={}, job will not fire again msg={}",
                    job.id(), job.schedule(), e.getMessage());
            return null;
        }
    }

    private void runJob(JobDefinition job, ExecutionToken token, Semaphore slots) {
        ExecutionOutcome outcome = ExecutionOutcome.FAILED;
        String error = ABNORMAL_TERMINATION;
        try {
            log.debug("jobkeeper job started id={} executionId={}", job.id(), token.executionId());
            invoker.invoke(job, token);
            outcome = ExecutionOutcome.SUCCEEDED;
            error = null;
        } catch (Exception e) {
            error = ErrorDetails.describe(e);
            log.warn("jobkeeper job failed id={} executionId={} msg={}", job.id(), token.executionId(), e.getMessage(), e);
        } finally {
            slots.release();
            reportCompletion(new Completion(token, outcome, error));
        }
    }

    private void reportCompletion(Completion completion) {
        completions.offer(completion);
        if (persistInline.get()) {
            drainCompletions(true);
        }
    }

    private void drainCompletions(boolean inline) {
        Completion c;
        while ((c = completions.poll()) != null) {
            if (persist(c, inline ? Math.max(1, props.getMaxCompletionAttempts()) : 1)) {
                continue;
            }
            if (!inline) {
                // retried at the next tick
                completions.offer(c);
                return;
            }
            log.error("jobkeeper giving up on completion id={} executionId={} outcome={}, record stays RUNNING until the next startup",
                    c.token().jobId(), c.token().executionId(), c.outcome());
            inFlight.remove(c.token().executionId());
        }
    }

    private boolean persist(Completion c, int attempts) {
        for (int attempt = 1; ; attempt++) {
            try {
                ExecutionRecord record = tracker.complete(c.token(), c.outcome(), c.error());
                inFlight.remove(c.token().executionId());
                log.debug("jobkeeper job finished id={} executionId={} outcome={} duration={}",
                        record.jobId(), record.executionId(), record.outcome(), record.duration());
                publish(ExecutionEvent.of(record));
                return true;
            } catch (StoreUnavailableException e) {
                if (attempt >= attempts) {
                    log.warn("jobkeeper could not persist completion executionId={} attempt={} msg={}",
                            c.token().executionId(), attempt, e.getMessage());
                    return false;
                }
                try {
                    Thread.sleep(backoff(attempt).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            } catch (RuntimeException e) {
                log.error("jobkeeper dropping completion executionId={} msg={}", c.token().executionId(), e.getMessage(), e);
                inFlight.remove(c.token().executionId());
                return true;
            }
        }
    }

    // Exponential backoff for completion writes: 200ms, 400ms, 800ms... capped at 30s.
    private Duration backoff(int attempt) {
        int exp = Math.max(0, Math.min(attempt - 1, 15));
        long ms = Math.min(200L * (1L << exp), 30_000L);
        return Duration.ofMillis(ms);
    }

    private void publish(ExecutionEvent event) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecution(event);
            } catch (RuntimeException e) {
                log.warn("jobkeeper execution listener failed id={} executionId={} msg={}",
                        event.jobId(), event.executionId(), e.getMessage(), e);
            }
        }
    }
}
