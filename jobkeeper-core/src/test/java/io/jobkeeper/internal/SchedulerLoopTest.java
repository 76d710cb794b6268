package io.jobkeeper.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.ExecutionListener;
import io.jobkeeper.JobHandler;
import io.jobkeeper.config.SchedulerProperties;
import io.jobkeeper.core.DueJob;
import io.jobkeeper.core.ExecutionEvent;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.core.StoreUnavailableException;
import io.jobkeeper.internal.memory.InMemoryExecutionTracker;
import io.jobkeeper.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.jobkeeper.internal.Waits.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerLoopTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private FlakyJobStore store;
    private FlakyExecutionTracker tracker;
    private final List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
    private SchedulerLoop loop;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new FlakyJobStore(clock);
        tracker = new FlakyExecutionTracker(clock);
    }

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.stop(Duration.ofSeconds(2));
        }
    }

    @Test
    void overdueJobShouldRunOnceAndScheduleFromNow() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1", NOW.minusSeconds(5)), NOW.minusSeconds(5));

        startLoop(defaultProps(), handler);

        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));
        loop.tick();

        assertEquals(1, handler.runs());
        assertEquals(1, tracker.history("report", 10).size());
        ScheduleState state = store.loadScheduleState("report").orElseThrow();
        assertEquals(NOW.plusSeconds(1), state.nextFireTime());
        assertEquals(NOW, state.lastFireTime());
        assertEquals(0, state.misfireCount());
    }

    @Test
    void lateDispatchShouldCountMisfire() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1 hour", NOW.minusSeconds(30)), NOW.minusSeconds(30));

        startLoop(defaultProps(), handler);

        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));
        assertEquals(1, store.loadScheduleState("report").orElseThrow().misfireCount());
    }

    @Test
    void secondRunShouldSeeLastSuccess() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1", NOW), NOW);

        startLoop(defaultProps(), handler);
        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> {
            loop.tick();
            return succeeded("report") == 2;
        }));

        assertNull(handler.contexts().get(0).lastSuccessAt());
        assertEquals(NOW, handler.contexts().get(1).lastSuccessAt());
        assertEquals(NOW.plusSeconds(1), handler.contexts().get(1).fireTime());
    }

    @Test
    void failingJobShouldNotAffectOtherJobs() throws Exception {
        RecordingHandler failing = new RecordingHandler("a-fail").failWith(new IllegalStateException("simulated failure"));
        RecordingHandler ok = new RecordingHandler("b-ok");
        addJob("a-fail", ScheduleSpec.interval("1 minute", NOW), NOW);
        addJob("b-ok", ScheduleSpec.interval("1 minute", NOW), NOW);

        startLoop(defaultProps(), failing, ok);

        assertTrue(waitForOutcome("a-fail", ExecutionOutcome.FAILED));
        assertTrue(waitForOutcome("b-ok", ExecutionOutcome.SUCCEEDED));

        ExecutionRecord failed = tracker.history("a-fail", 1).get(0);
        assertTrue(failed.error().contains("simulated failure"));
        assertEquals(NOW.plusSeconds(60), store.loadScheduleState("a-fail").orElseThrow().nextFireTime());
        assertTrue(events.stream().anyMatch(e -> e.jobId().equals("a-fail") && e.outcome() == ExecutionOutcome.FAILED));
        assertTrue(events.stream().anyMatch(e -> e.jobId().equals("b-ok") && e.outcome() == ExecutionOutcome.SUCCEEDED));
    }

    @Test
    void dueWhileRunningShouldBeSkippedAsDuplicate() throws Exception {
        RecordingHandler slow = new RecordingHandler("slow").blockUntilReleased();
        addJob("slow", ScheduleSpec.interval("1", NOW), NOW);

        startLoop(defaultProps(), slow);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> slow.runs() == 1));

        clock.advance(Duration.ofSeconds(2));
        loop.tick();

        List<ExecutionRecord> history = tracker.history("slow", 10);
        assertEquals(2, history.size());
        assertTrue(history.stream().anyMatch(r -> r.outcome() == ExecutionOutcome.SKIPPED_DUPLICATE));
        assertTrue(history.stream().anyMatch(ExecutionRecord::isRunning));
        assertEquals(NOW.plusSeconds(3), store.loadScheduleState("slow").orElseThrow().nextFireTime());
        assertTrue(events.stream().anyMatch(e -> e.outcome() == ExecutionOutcome.SKIPPED_DUPLICATE));

        slow.release();
        assertTrue(waitForOutcome("slow", ExecutionOutcome.SUCCEEDED));
        assertEquals(1, slow.runs());
    }

    @Test
    void saturatedPoolShouldDeferInsteadOfSkipping() throws Exception {
        SchedulerProperties props = defaultProps();
        props.setMaxConcurrency(1);
        RecordingHandler first = new RecordingHandler("a-first").blockUntilReleased();
        RecordingHandler second = new RecordingHandler("b-second");
        addJob("a-first", ScheduleSpec.interval("1 hour", NOW), NOW);
        addJob("b-second", ScheduleSpec.interval("1 hour", NOW), NOW);

        startLoop(props, first, second);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> first.runs() == 1));
        loop.tick();

        assertTrue(tracker.history("b-second", 10).isEmpty());
        assertEquals(NOW, store.loadScheduleState("b-second").orElseThrow().nextFireTime());

        first.release();
        assertTrue(waitForOutcome("b-second", ExecutionOutcome.SUCCEEDED));
    }

    @Test
    void onceJobShouldBeExhaustedAfterItsRun() throws Exception {
        RecordingHandler handler = new RecordingHandler("once");
        addJob("once", ScheduleSpec.once(NOW.minusSeconds(1)), NOW.minusSeconds(1));

        startLoop(defaultProps(), handler);
        assertTrue(waitForOutcome("once", ExecutionOutcome.SUCCEEDED));

        clock.advance(Duration.ofHours(1));
        loop.tick();

        assertNull(store.loadScheduleState("once").orElseThrow().nextFireTime());
        assertEquals(1, handler.runs());
    }

    @Test
    void unreachableStoreShouldSkipTick() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1 minute", NOW), NOW);
        store.down = true;

        startLoop(defaultProps(), handler);
        loop.tick();

        assertEquals(0, handler.runs());
        assertEquals(NOW, loop.status().lastTickAt());
        assertTrue(loop.status().running());

        store.down = false;
        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));
    }

    @Test
    void completionShouldBeRetriedWhileTrackerIsUnreachable() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1 hour", NOW), NOW);
        tracker.completeDown = true;

        startLoop(defaultProps(), handler);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> {
            loop.tick();
            return tracker.failedCompletes.get() >= 1;
        }));

        assertTrue(tracker.findRunning("report").isPresent());
        assertEquals(1, loop.status().inFlight());

        tracker.completeDown = false;
        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));
        assertEquals(0, loop.status().inFlight());
    }

    @Test
    void stopShouldLeaveUnfinishedRunsAlone() throws Exception {
        RecordingHandler slow = new RecordingHandler("slow").blockUntilReleased();
        addJob("slow", ScheduleSpec.interval("1 hour", NOW), NOW);

        startLoop(defaultProps(), slow);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> slow.runs() == 1));

        boolean drained = loop.stop(Duration.ofMillis(200));

        assertFalse(drained);
        assertFalse(loop.isRunning());
        assertTrue(tracker.findRunning("slow").isPresent());

        slow.release();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> succeeded("slow") == 1));
        assertTrue(tracker.findRunning("slow").isEmpty());
    }

    @Test
    void stateChangedDuringDispatchShouldWinOverLoopWrite() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1 minute", NOW), NOW);
        Instant rescheduled = NOW.plusSeconds(3600);
        store.afterFindDue = () -> {
            ScheduleState read = store.loadScheduleState("report").orElseThrow();
            store.replaceScheduleState("report", read, read.withNextFireTime(rescheduled));
        };

        startLoop(defaultProps(), handler);
        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));

        assertEquals(ScheduleState.initial(rescheduled), store.loadScheduleState("report").orElseThrow());
        assertEquals(1, handler.runs());
    }

    @Test
    void jobRemovedDuringDispatchShouldStayRemoved() throws Exception {
        RecordingHandler handler = new RecordingHandler("report");
        addJob("report", ScheduleSpec.interval("1 minute", NOW), NOW);
        store.afterFindDue = () -> store.remove("report");

        startLoop(defaultProps(), handler);
        assertTrue(waitForOutcome("report", ExecutionOutcome.SUCCEEDED));

        assertTrue(store.get("report").isEmpty());
        assertTrue(store.loadScheduleState("report").isEmpty());
    }

    @Test
    void secondLiveInstanceShouldNotRunBusyJobAgain() throws Exception {
        RecordingHandler slow = new RecordingHandler("slow").blockUntilReleased();
        addJob("slow", ScheduleSpec.interval("1", NOW), NOW);
        startLoop(defaultProps(), slow);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> slow.runs() == 1));
        String firstRun = tracker.findRunning("slow").orElseThrow().executionId();

        SchedulerProperties otherProps = otherInstanceProps("owner-b");
        SchedulerLoop other = otherInstance(otherProps, slow);
        LifecycleGuard otherGuard = new LifecycleGuard(otherProps, store, tracker, other, clock);
        try {
            otherGuard.start();
            clock.advance(Duration.ofSeconds(2));
            other.tick();

            // the first instance heartbeats while its run goes on well past the stale timeout
            clock.advance(Duration.ofSeconds(40));
            loop.tick();
            clock.advance(Duration.ofSeconds(40));
            other.tick();

            assertEquals(1, slow.runs());
            assertEquals(firstRun, tracker.findRunning("slow").orElseThrow().executionId());
            assertTrue(tracker.history("slow", 10).stream()
                    .noneMatch(r -> r.outcome() == ExecutionOutcome.FAILED));
            assertTrue(tracker.history("slow", 10).stream()
                    .anyMatch(r -> r.outcome() == ExecutionOutcome.SKIPPED_DUPLICATE));
        } finally {
            slow.release();
            otherGuard.stop(Duration.ofSeconds(2));
        }
        assertTrue(waitForOutcome("slow", ExecutionOutcome.SUCCEEDED));
    }

    @Test
    void runOfSilentInstanceShouldBeRecoveredAfterStaleTimeout() throws Exception {
        RecordingHandler slow = new RecordingHandler("slow").blockUntilReleased();
        addJob("slow", ScheduleSpec.interval("1", NOW), NOW);
        startLoop(defaultProps(), slow);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> slow.runs() == 1));
        String firstRun = tracker.findRunning("slow").orElseThrow().executionId();

        SchedulerLoop other = otherInstance(otherInstanceProps("owner-b"), slow);
        try {
            clock.advance(Duration.ofMinutes(2));
            other.start();
            assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> slow.runs() == 2));

            ExecutionRecord recovered = tracker.findById(firstRun).orElseThrow();
            assertEquals(ExecutionOutcome.FAILED, recovered.outcome());
            assertTrue(recovered.error().contains("test-owner"));
        } finally {
            slow.release();
            other.stop(Duration.ofSeconds(2));
        }
    }

    @Test
    void stopShouldBeIdempotent() {
        startLoop(defaultProps());

        assertTrue(loop.stop(Duration.ofSeconds(1)));
        assertTrue(loop.stop(Duration.ofSeconds(1)));
    }

    private void startLoop(SchedulerProperties props, RecordingHandler... handlers) {
        ExecutionListener throwing = event -> {
            throw new IllegalStateException("listener failure");
        };
        loop = new SchedulerLoop(
                props,
                store,
                tracker,
                new JobHandlerRegistry(List.<JobHandler<?>>of(handlers)),
                new ObjectMapper(),
                List.<ExecutionListener>of(throwing, events::add),
                clock
        );
        loop.start();
    }

    private static SchedulerProperties otherInstanceProps(String ownerId) {
        SchedulerProperties props = defaultProps();
        props.setOwnerId(ownerId);
        props.setSingleInstancePerProcess(false);
        return props;
    }

    private SchedulerLoop otherInstance(SchedulerProperties props, RecordingHandler... handlers) {
        return new SchedulerLoop(props, store, tracker, new JobHandlerRegistry(List.<JobHandler<?>>of(handlers)),
                new ObjectMapper(), List.of(), clock);
    }

    private void addJob(String id, ScheduleSpec schedule, Instant nextFireTime) {
        store.add(new JobDefinition(id, id, Map.of("k", "v"), schedule, true, NOW, NOW, 0L));
        store.saveScheduleState(id, ScheduleState.initial(nextFireTime));
    }

    private boolean waitForOutcome(String jobId, ExecutionOutcome outcome) throws InterruptedException {
        return waitUntil(5, TimeUnit.SECONDS, () -> {
            loop.tick();
            return tracker.history(jobId, 10).stream().anyMatch(r -> r.outcome() == outcome);
        });
    }

    private long succeeded(String jobId) {
        return tracker.history(jobId, 100).stream().filter(r -> r.outcome() == ExecutionOutcome.SUCCEEDED).count();
    }

    private static SchedulerProperties defaultProps() {
        SchedulerProperties props = new SchedulerProperties();
        props.setTickInterval(Duration.ofHours(1));
        props.setMaxConcurrency(4);
        props.setOwnerId("test-owner");
        props.setMaxCompletionAttempts(2);
        return props;
    }

    static class FlakyJobStore extends InMemoryJobStore {
        volatile boolean down;
        volatile Runnable afterFindDue;

        FlakyJobStore(MutableClock clock) {
            super(clock);
        }

        @Override
        public List<DueJob> findDue(Instant now, int limit) {
            if (down) {
                throw new StoreUnavailableException("job store down", null);
            }
            List<DueJob> due = super.findDue(now, limit);
            Runnable hook = afterFindDue;
            if (hook != null) {
                afterFindDue = null;
                hook.run();
            }
            return due;
        }
    }

    static class FlakyExecutionTracker extends InMemoryExecutionTracker {
        volatile boolean completeDown;
        final AtomicInteger failedCompletes = new AtomicInteger();

        FlakyExecutionTracker(MutableClock clock) {
            super("test-owner", clock);
        }

        @Override
        public ExecutionRecord complete(ExecutionToken token, ExecutionOutcome outcome, String error) {
            if (completeDown) {
                failedCompletes.incrementAndGet();
                throw new StoreUnavailableException("tracker down", null);
            }
            return super.complete(token, outcome, error);
        }
    }
}
