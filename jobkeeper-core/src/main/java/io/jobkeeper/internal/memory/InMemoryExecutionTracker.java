package io.jobkeeper.internal.memory;

import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.spi.ExecutionTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ExecutionTracker}. The running slot of a job is a {@code putIfAbsent}
 * on a concurrent map, so only one caller can hold it at a time.
 */
public class InMemoryExecutionTracker implements ExecutionTracker {

    private final Map<String, String> runningByJob = new ConcurrentHashMap<>();
    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Instant> heartbeats = new ConcurrentHashMap<>();
    private final String ownerId;
    private final Clock clock;

    public InMemoryExecutionTracker(String ownerId) {
        this(ownerId, Clock.systemUTC());
    }

    public InMemoryExecutionTracker(String ownerId, Clock clock) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<ExecutionToken> tryBegin(String jobId, Instant fireTime) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        String executionId = UUID.randomUUID().toString();
        if (runningByJob.putIfAbsent(jobId, executionId) != null) {
            return Optional.empty();
        }
        Instant startedAt = now();
        heartbeats.put(executionId, startedAt);
        records.put(executionId, new ExecutionRecord(
                executionId, jobId, fireTime, startedAt, null, ExecutionOutcome.RUNNING, null, ownerId));
        return Optional.of(new ExecutionToken(executionId, jobId, fireTime, startedAt));
    }

    @Override
    public ExecutionRecord complete(ExecutionToken token, ExecutionOutcome outcome, String error) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (!outcome.isFinal()) {
            throw new IllegalArgumentException("outcome must be final: " + outcome);
        }

        Instant finishedAt = now();
        ExecutionRecord result = records.computeIfPresent(token.executionId(),
                (id, current) -> current.isRunning() ? current.finish(finishedAt, outcome, error) : current);
        runningByJob.remove(token.jobId(), token.executionId());
        heartbeats.remove(token.executionId());
        if (result == null) {
            throw new IllegalArgumentException("unknown execution: " + token.executionId());
        }
        return result;
    }

    @Override
    public ExecutionRecord recordSkipped(String jobId, Instant fireTime) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Instant now = now();
        ExecutionRecord record = new ExecutionRecord(UUID.randomUUID().toString(), jobId, fireTime, now, now,
                ExecutionOutcome.SKIPPED_DUPLICATE, null, ownerId);
        records.put(record.executionId(), record);
        return record;
    }

    @Override
    public Optional<ExecutionRecord> findRunning(String jobId) {
        String executionId = runningByJob.get(jobId);
        if (executionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(executionId)).filter(ExecutionRecord::isRunning);
    }

    @Override
    public Optional<ExecutionRecord> findById(String executionId) {
        return Optional.ofNullable(records.get(executionId));
    }

    @Override
    public List<ExecutionRecord> history(String jobId, int limit) {
        return records.values().stream()
                .filter(r -> r.jobId().equals(jobId))
                .sorted(newestFirst())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public Optional<ExecutionRecord> lastCompleted(String jobId, ExecutionOutcome outcome) {
        return records.values().stream()
                .filter(r -> r.jobId().equals(jobId) && r.outcome() == outcome)
                .min(newestFirst());
    }

    @Override
    public long deleteHistory(String jobId) {
        long before = records.size();
        records.values().removeIf(r -> r.jobId().equals(jobId) && !r.isRunning());
        return before - records.size();
    }

    @Override
    public int heartbeat(String ownerId, Instant now) {
        int refreshed = 0;
        for (ExecutionRecord r : records.values()) {
            if (r.isRunning() && ownerId.equals(r.ownerId())) {
                heartbeats.put(r.executionId(), now);
                refreshed++;
            }
        }
        return refreshed;
    }

    @Override
    public int recoverInterrupted(String currentOwnerId, Instant now, Duration staleAfter) {
        Instant cutoff = now.minus(staleAfter);
        int recovered = 0;
        for (ExecutionRecord r : List.copyOf(records.values())) {
            if (!r.isRunning() || currentOwnerId.equals(r.ownerId())) {
                continue;
            }
            Instant lastSeen = heartbeats.getOrDefault(r.executionId(), r.startedAt());
            if (!lastSeen.isBefore(cutoff)) {
                continue;
            }
            ExecutionRecord failed = r.finish(now, ExecutionOutcome.FAILED,
                    "interrupted: scheduler instance " + r.ownerId() + " stopped heartbeating since " + lastSeen);
            if (records.replace(r.executionId(), r, failed)) {
                runningByJob.remove(r.jobId(), r.executionId());
                heartbeats.remove(r.executionId());
                recovered++;
            }
        }
        return recovered;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Comparator<ExecutionRecord> newestFirst() {
        return Comparator.comparing(ExecutionRecord::startedAt).reversed()
                .thenComparing(ExecutionRecord::executionId);
    }
}
