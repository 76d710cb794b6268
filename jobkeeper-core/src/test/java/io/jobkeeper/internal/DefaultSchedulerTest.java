package io.jobkeeper.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.JobHandler;
import io.jobkeeper.Scheduler;
import io.jobkeeper.config.SchedulerProperties;
import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.JobBusyException;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.core.JobNotFoundException;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleKind;
import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.internal.memory.InMemoryExecutionTracker;
import io.jobkeeper.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.jobkeeper.internal.Waits.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private ContendedJobStore store;
    private InMemoryExecutionTracker tracker;
    private RecordingHandler report;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new ContendedJobStore(clock);
        tracker = new InMemoryExecutionTracker("test-owner", clock);
        report = new RecordingHandler("report");

        SchedulerProperties props = new SchedulerProperties();
        props.setOwnerId("test-owner");
        props.setTickInterval(Duration.ofMillis(50));

        scheduler = new DefaultScheduler(props, store, tracker,
                new JobHandlerRegistry(List.<JobHandler<?>>of(report)), new ObjectMapper(), List.of(), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop(Duration.ofSeconds(2));
    }

    @Test
    void saveShouldPersistDefinitionAndFirstFireTime() {
        JobDefinition saved = scheduler.create("report", Map.of("region", "us"))
                .every("5 minutes")
                .save();

        assertEquals("report", saved.id());
        assertEquals(ScheduleKind.INTERVAL, saved.schedule().kind());
        assertEquals(Map.of("region", "us"), saved.data());
        assertEquals(0L, saved.version());
        assertEquals(NOW.plusSeconds(300), scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void dailyAtShouldUseJobTimezone() {
        scheduler.create("report")
                .id("report-chicago")
                .dailyAt("08:00")
                .timezone("America/Chicago")
                .save();

        // 12:00 UTC is 06:00 CST, so the same day at 08:00 CST (14:00 UTC)
        assertEquals(Instant.parse("2026-03-01T14:00:00Z"),
                scheduler.state("report-chicago").orElseThrow().nextFireTime());
    }

    @Test
    void pastOnceJobShouldBeDueImmediately() {
        Instant past = NOW.minusSeconds(3600);

        scheduler.create("report").once(past).save();

        assertEquals(past, scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void runImmediatelyAndDisabledShouldControlFirstFireTime() {
        scheduler.create("report").id("now").every("1 hour").runImmediately().save();
        scheduler.create("report").id("off").every("1 hour").disabled().save();

        assertEquals(NOW, scheduler.state("now").orElseThrow().nextFireTime());
        assertNull(scheduler.state("off").orElseThrow().nextFireTime());
        assertEquals(List.of("now"), scheduler.list(JobFilter.enabledOnly()).stream().map(JobDefinition::id).toList());
    }

    @Test
    void duplicateIdShouldConflictUnlessReplacing() {
        scheduler.create("report").every("1 hour").save();

        assertThrows(ConflictException.class, () -> scheduler.create("report").every("1 hour").save());

        JobDefinition replaced = scheduler.create("report").cron("0 0 6 * * ?").timezone("UTC").replaceExisting().save();
        assertEquals(ScheduleKind.CRON, replaced.schedule().kind());
        assertEquals(1L, replaced.version());
        assertEquals(Instant.parse("2026-03-02T06:00:00Z"), scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void replacingWithSameScheduleShouldKeepPendingFireTime() {
        scheduler.create("report").every("1 hour").save();
        clock.advance(Duration.ofMinutes(70));

        scheduler.create("report").every("1 hour").replaceExisting().save();

        // the 13:00 occurrence missed while "down" is still pending
        assertEquals(NOW.plusSeconds(3600), scheduler.state("report").orElseThrow().nextFireTime());
        assertEquals(NOW, scheduler.get("report").orElseThrow().schedule().startAt());
    }

    @Test
    void unknownHandlerShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("missing").every("1 hour").save());
        assertTrue(scheduler.get("missing").isEmpty());
    }

    @Test
    void invalidScheduleShouldBeRejectedByBuilder() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("report").cron("0 61 * * * ?"));
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("report").every("soon"));
        assertThrows(IllegalStateException.class, () -> scheduler.create("report").save());
        assertThrows(IllegalStateException.class, () -> scheduler.create("report").every("1 hour").cron("0 0 6 * * ?"));
    }

    @Test
    void nonObjectDataShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.create("report", "plain text"));
    }

    @Test
    void disableAndEnableShouldRecomputeNextFireTime() {
        scheduler.create("report").every("10 minutes").save();

        scheduler.disable("report");
        assertNull(scheduler.state("report").orElseThrow().nextFireTime());
        assertFalse(scheduler.get("report").orElseThrow().enabled());

        clock.advance(Duration.ofMinutes(25));
        scheduler.enable("report");
        assertEquals(NOW.plusSeconds(1800), scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void updateWithStaleVersionShouldConflict() {
        scheduler.create("report").every("10 minutes").save();
        scheduler.update("report", JobUpdate.builder().data(Map.of("a", 1)).expectedVersion(0L).build());

        assertThrows(ConflictException.class,
                () -> scheduler.update("report", JobUpdate.builder().data(Map.of("a", 2)).expectedVersion(0L).build()));
    }

    @Test
    void updateOfScheduleShouldReschedule() {
        scheduler.create("report").every("10 minutes").save();

        scheduler.update("report", JobUpdate.builder()
                .schedule(ScheduleSpec.interval("1 minute", NOW))
                .build());

        assertEquals(NOW.plusSeconds(60), scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void runNowShouldMakeJobDue() {
        scheduler.create("report").every("1 hour").save();

        scheduler.runNow("report");

        assertEquals(NOW, scheduler.state("report").orElseThrow().nextFireTime());
    }

    @Test
    void runNowShouldRejectBusyMissingAndDisabledJobs() {
        scheduler.create("report").every("1 hour").save();
        scheduler.create("report").id("off").every("1 hour").disabled().save();
        tracker.tryBegin("report", NOW).orElseThrow();

        assertThrows(JobBusyException.class, () -> scheduler.runNow("report"));
        assertThrows(JobNotFoundException.class, () -> scheduler.runNow("missing"));
        assertThrows(IllegalStateException.class, () -> scheduler.runNow("off"));
    }

    @Test
    void removeShouldDeleteDefinitionStateAndHistory() {
        scheduler.create("report").every("1 hour").save();
        tracker.recordSkipped("report", NOW);

        assertTrue(scheduler.remove("report"));

        assertTrue(scheduler.get("report").isEmpty());
        assertTrue(scheduler.state("report").isEmpty());
        assertTrue(scheduler.history("report", 10).isEmpty());
        assertFalse(scheduler.remove("report"));
    }

    @Test
    void startedSchedulerShouldRunTriggeredJob() throws Exception {
        scheduler.create("report", Map.of("region", "us")).every("1 hour").save();
        scheduler.start();

        scheduler.runNow("report");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> scheduler.history("report", 10).stream()
                .anyMatch(r -> r.outcome() == ExecutionOutcome.SUCCEEDED)));
        assertEquals(1, report.runs());
        assertEquals(Map.of("region", "us"), report.payloads().get(0));
        assertEquals("test-owner", scheduler.status().ownerId());
        assertTrue(scheduler.isRunning());

        ScheduleState state = scheduler.state("report").orElseThrow();
        assertEquals(NOW, state.lastFireTime());
        assertEquals(NOW.plusSeconds(3600), state.nextFireTime());
    }

    @Test
    void runNowShouldRetryWhenLoopAdvancedStateConcurrently() {
        scheduler.create("report").every("1 hour").save();
        store.concurrentAdvances = 2;

        scheduler.runNow("report");

        ScheduleState state = scheduler.state("report").orElseThrow();
        assertEquals(NOW, state.nextFireTime());
        assertEquals(NOW, state.lastFireTime());
        assertEquals(2, state.misfireCount());
    }

    @Test
    void updateShouldConflictWhenStateKeepsChanging() {
        scheduler.create("report").every("1 hour").save();
        store.concurrentAdvances = 100;

        assertThrows(ConflictException.class,
                () -> scheduler.update("report", JobUpdate.builder().schedule(ScheduleSpec.interval("5 minutes", NOW)).build()));
    }

    @Test
    void reRegisteringShouldNotInheritLeftoverState() {
        scheduler.create("report").every("1 hour").save();
        scheduler.remove("report");
        store.saveScheduleState("report", new ScheduleState(NOW.plusSeconds(60), NOW.minusSeconds(60), 7));

        scheduler.create("report").every("1 hour").save();

        assertEquals(ScheduleState.initial(NOW.plusSeconds(3600)), scheduler.state("report").orElseThrow());
    }

    /**
     * Lets a simulated loop write land between the read and the conditional write of the
     * management API.
     */
    static class ContendedJobStore extends InMemoryJobStore {
        volatile int concurrentAdvances;

        ContendedJobStore(MutableClock clock) {
            super(clock);
        }

        @Override
        public void replaceScheduleState(String id, ScheduleState expected, ScheduleState next) {
            if (concurrentAdvances > 0) {
                concurrentAdvances--;
                ScheduleState current = loadScheduleState(id).orElseThrow();
                super.replaceScheduleState(id, current,
                        new ScheduleState(current.nextFireTime(), NOW, current.misfireCount() + 1));
            }
            super.replaceScheduleState(id, expected, next);
        }
    }
}
