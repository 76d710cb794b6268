package io.jobkeeper.internal;

import io.jobkeeper.config.SchedulerProperties;
import io.jobkeeper.core.SchedulerStartupException;
import io.jobkeeper.core.StoreUnavailableException;
import io.jobkeeper.spi.ExecutionTracker;
import io.jobkeeper.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the {@link SchedulerLoop} and makes sure it is started at most once.
 *
 * <p>Repeated {@code start()} calls on the same guard are no-ops. When
 * {@code singleInstancePerProcess} is set, only one guard in the JVM may be started at a time;
 * a second one fails to start instead of running a second loop against the same jobs.
 */
public class LifecycleGuard {
    private static final Logger log = LoggerFactory.getLogger(LifecycleGuard.class);

    private static final AtomicReference<LifecycleGuard> ACTIVE = new AtomicReference<>();

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final ExecutionTracker tracker;
    private final SchedulerLoop loop;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public LifecycleGuard(SchedulerProperties props,
                          JobStore jobStore,
                          ExecutionTracker tracker,
                          SchedulerLoop loop,
                          Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Initialize the job store, recover executions whose scheduler instance stopped
     * heartbeating and start the loop. Runs of instances that are still alive are left alone.
     *
     * @throws IllegalStateException if another scheduler is already active in this process
     * @throws SchedulerStartupException if the job store cannot be initialized
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("jobkeeper already started ownerId={}", loop.ownerId());
            return;
        }
        if (props.isSingleInstancePerProcess() && !ACTIVE.compareAndSet(null, this)) {
            started.set(false);
            throw new IllegalStateException("Another jobkeeper scheduler is already active in this process");
        }

        try {
            jobStore.initialize();
        } catch (RuntimeException e) {
            release();
            throw new SchedulerStartupException("jobkeeper job store failed to initialize: " + e.getMessage(), e);
        }

        try {
            recoverInterrupted();
            loop.start();
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        log.info("jobkeeper started ownerId={}", loop.ownerId());
    }

    /**
     * Stop using the configured shutdown grace period.
     */
    public boolean stop() {
        return stop(props.getShutdownGracePeriod());
    }

    /**
     * Stop the loop, waiting up to {@code gracePeriod} for running jobs. Idempotent.
     */
    public boolean stop(Duration gracePeriod) {
        if (!started.compareAndSet(true, false)) {
            return true;
        }
        try {
            return loop.stop(gracePeriod);
        } finally {
            ACTIVE.compareAndSet(this, null);
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    private void recoverInterrupted() {
        try {
            Duration staleAfter = Objects.requireNonNull(props.getStaleRunTimeout(),
                    "jobkeeper.staleRunTimeout must not be null");
            int recovered = tracker.recoverInterrupted(loop.ownerId(),
                    clock.instant().truncatedTo(ChronoUnit.MILLIS), staleAfter);
            if (recovered > 0) {
                log.warn("jobkeeper marked interrupted executions as failed count={} staleRunTimeout={}",
                        recovered, staleAfter);
            }
        } catch (StoreUnavailableException e) {
            log.warn("jobkeeper could not recover interrupted executions msg={}", e.getMessage());
        }
    }

    private void release() {
        started.set(false);
        ACTIVE.compareAndSet(this, null);
    }
}
