package io.jobkeeper.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.core.ScheduleState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoExecutionTrackerIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant FIRE = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    private static final Duration STALE_AFTER = Duration.ofSeconds(60);

    private MongoTemplate mongoTemplate;
    private MongoExecutionTracker tracker;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "jobkeeper_test");
        dropAll();
        tracker = new MongoExecutionTracker(mongoTemplate, "owner-A");
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void tryBeginShouldGrantSingleTokenPerJob() {
        ExecutionToken token = tracker.tryBegin("sync", FIRE).orElseThrow();

        assertTrue(tracker.tryBegin("sync", FIRE).isEmpty());
        assertTrue(tracker.tryBegin("other", FIRE).isPresent());

        ExecutionRecord running = tracker.findRunning("sync").orElseThrow();
        assertEquals(token.executionId(), running.executionId());
        assertEquals(ExecutionOutcome.RUNNING, running.outcome());
        assertEquals("owner-A", running.ownerId());
        assertEquals(FIRE, running.fireTime());
    }

    @Test
    void concurrentTryBeginShouldGrantExactlyOneToken() throws Exception {
        int callers = 12;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<ExecutionToken>>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                MongoExecutionTracker contender = new MongoExecutionTracker(mongoTemplate, "owner-" + i);
                Callable<Optional<ExecutionToken>> attempt = () -> {
                    go.await();
                    return contender.tryBegin("contended", FIRE);
                };
                results.add(pool.submit(attempt));
            }
            go.countDown();

            int winners = 0;
            for (Future<Optional<ExecutionToken>> r : results) {
                if (r.get(30, TimeUnit.SECONDS).isPresent()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(1, tracker.history("contended", 100).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeShouldFinalizeOnceAndReleaseSlot() {
        ExecutionToken token = tracker.tryBegin("sync", FIRE).orElseThrow();

        ExecutionRecord done = tracker.complete(token, ExecutionOutcome.SUCCEEDED, null);
        ExecutionRecord again = tracker.complete(token, ExecutionOutcome.FAILED, "late");

        assertEquals(ExecutionOutcome.SUCCEEDED, done.outcome());
        assertNotNull(done.finishedAt());
        assertEquals(done, again);
        assertTrue(tracker.findRunning("sync").isEmpty());
        assertTrue(tracker.tryBegin("sync", FIRE.plusSeconds(60)).isPresent());
    }

    @Test
    void completeShouldRejectNonFinalOutcomeAndUnknownToken() {
        ExecutionToken token = tracker.tryBegin("sync", FIRE).orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> tracker.complete(token, ExecutionOutcome.RUNNING, null));
        ExecutionToken unknown = new ExecutionToken("nope", "sync", FIRE, FIRE);
        assertThrows(IllegalArgumentException.class, () -> tracker.complete(unknown, ExecutionOutcome.SUCCEEDED, null));
        assertTrue(tracker.findRunning("sync").isPresent());
    }

    @Test
    void tryBeginShouldLeaveScheduleFieldsOfExistingStateAlone() {
        MongoJobStore store = new MongoJobStore(mongoTemplate, new ObjectMapper());
        store.saveScheduleState("sync", new ScheduleState(FIRE.plusSeconds(300), FIRE, 1));

        ExecutionToken token = tracker.tryBegin("sync", FIRE).orElseThrow();
        store.saveScheduleState("sync", new ScheduleState(FIRE.plusSeconds(600), FIRE, 1));

        assertTrue(tracker.tryBegin("sync", FIRE).isEmpty());
        tracker.complete(token, ExecutionOutcome.FAILED, "boom");
        assertEquals(FIRE.plusSeconds(600), store.loadScheduleState("sync").orElseThrow().nextFireTime());
    }

    @Test
    void historyShouldListNewestFirstAndDeleteHistoryShouldKeepRunning() throws Exception {
        ExecutionRecord skipped = tracker.recordSkipped("sync", FIRE);
        TimeUnit.MILLISECONDS.sleep(5);
        ExecutionToken first = tracker.tryBegin("sync", FIRE).orElseThrow();
        tracker.complete(first, ExecutionOutcome.FAILED, "boom");
        TimeUnit.MILLISECONDS.sleep(5);
        ExecutionToken second = tracker.tryBegin("sync", FIRE.plusSeconds(60)).orElseThrow();

        List<ExecutionRecord> history = tracker.history("sync", 10);
        assertEquals(List.of(second.executionId(), first.executionId(), skipped.executionId()),
                history.stream().map(ExecutionRecord::executionId).toList());
        assertEquals(ExecutionOutcome.SKIPPED_DUPLICATE, skipped.outcome());
        assertEquals("boom", tracker.lastCompleted("sync", ExecutionOutcome.FAILED).orElseThrow().error());
        assertTrue(tracker.lastCompleted("sync", ExecutionOutcome.SUCCEEDED).isEmpty());

        assertEquals(2, tracker.deleteHistory("sync"));
        assertEquals(List.of(second.executionId()),
                tracker.history("sync", 10).stream().map(ExecutionRecord::executionId).toList());
    }

    @Test
    void recoverInterruptedShouldFailStaleRunsOfOtherOwners() {
        MongoExecutionTracker crashed = new MongoExecutionTracker(mongoTemplate, "owner-dead");
        ExecutionToken orphan = crashed.tryBegin("sync", FIRE).orElseThrow();
        ExecutionToken own = tracker.tryBegin("mine", FIRE).orElseThrow();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS).plus(Duration.ofMinutes(2));

        assertEquals(0, tracker.recoverInterrupted("owner-A", now, Duration.ofMinutes(5)));
        assertTrue(tracker.findRunning("sync").isPresent());

        int recovered = tracker.recoverInterrupted("owner-A", now, STALE_AFTER);

        assertEquals(1, recovered);
        ExecutionRecord failed = tracker.findById(orphan.executionId()).orElseThrow();
        assertEquals(ExecutionOutcome.FAILED, failed.outcome());
        assertEquals(now, failed.finishedAt());
        assertTrue(failed.error().contains("owner-dead"));
        assertTrue(tracker.findRunning("sync").isEmpty());
        assertTrue(tracker.tryBegin("sync", now).isPresent());

        assertEquals(ExecutionOutcome.RUNNING, tracker.findById(own.executionId()).orElseThrow().outcome());
        assertFalse(tracker.tryBegin("mine", now).isPresent());
        assertNull(tracker.findById(own.executionId()).orElseThrow().finishedAt());
    }

    @Test
    void heartbeatShouldKeepRunOfLiveOwner() {
        MongoExecutionTracker live = new MongoExecutionTracker(mongoTemplate, "owner-live");
        ExecutionToken running = live.tryBegin("sync", FIRE).orElseThrow();
        live.tryBegin("other", FIRE).orElseThrow();

        assertEquals(2, live.heartbeat("owner-live", FIRE.plusSeconds(100)));
        assertEquals(0, tracker.recoverInterrupted("owner-A", FIRE.plusSeconds(120), STALE_AFTER));

        assertTrue(tracker.tryBegin("sync", FIRE.plusSeconds(120)).isEmpty());
        ExecutionRecord record = live.complete(running, ExecutionOutcome.SUCCEEDED, null);
        assertEquals(ExecutionOutcome.SUCCEEDED, record.outcome());
        assertEquals(0, tracker.heartbeat("owner-A", FIRE.plusSeconds(130)));
    }

    private void dropAll() {
        mongoTemplate.dropCollection(ScheduleStateDocument.class);
        mongoTemplate.dropCollection(ExecutionRecordDocument.class);
    }
}
