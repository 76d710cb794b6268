package io.jobkeeper.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.spi.ExecutionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * MongoDB {@link ExecutionTracker}.
 *
 * <p>The running slot of a job is a marker on its {@code schedule_state} row, claimed with one
 * conditional upsert: the filter {@code {_id: jobId, runningExecutionId: null}} matches only a
 * free slot, and when the slot is taken the upsert tries to insert a second row with the same
 * {@code _id}, which the server rejects with a duplicate key error. Only the winner writes a
 * RUNNING record to {@code execution_records}.
 *
 * <p>The owner refreshes {@code heartbeatAt} on its RUNNING records; another instance only
 * recovers a run after its heartbeat has been silent for the stale timeout.
 */
public class MongoExecutionTracker implements ExecutionTracker {
    private static final Logger log = LoggerFactory.getLogger(MongoExecutionTracker.class);

    private static final String HEARTBEAT_AT = "heartbeatAt";

    private final MongoTemplate mongoTemplate;
    private final String ownerId;
    private final Clock clock;

    public MongoExecutionTracker(MongoTemplate mongoTemplate, String ownerId) {
        this(mongoTemplate, ownerId, Clock.systemUTC());
    }

    public MongoExecutionTracker(MongoTemplate mongoTemplate, String ownerId, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<ExecutionToken> tryBegin(String jobId, Instant fireTime) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        String executionId = UUID.randomUUID().toString();
        Instant startedAt = now();

        boolean claimed = MongoCalls.call("tryBegin", () -> {
            Query free = new Query(Criteria.where("_id").is(jobId)
                    .and(ScheduleStateDocument.RUNNING_EXECUTION_ID).is(null));
            Update claim = new Update()
                    .set(ScheduleStateDocument.RUNNING_EXECUTION_ID, executionId)
                    .set(ScheduleStateDocument.RUNNING_SINCE, startedAt)
                    .set(ScheduleStateDocument.RUNNING_OWNER, ownerId);
            try {
                mongoTemplate.upsert(free, claim, ScheduleStateDocument.class);
                return true;
            } catch (DuplicateKeyException e) {
                return false;
            }
        });
        if (!claimed) {
            return Optional.empty();
        }

        ExecutionRecordDocument doc = new ExecutionRecordDocument();
        doc.setId(executionId);
        doc.setJobId(jobId);
        doc.setFireTime(fireTime);
        doc.setStartedAt(startedAt);
        doc.setOutcome(ExecutionOutcome.RUNNING);
        doc.setOwnerId(ownerId);
        doc.setHeartbeatAt(startedAt);
        try {
            MongoCalls.run("tryBegin", () -> mongoTemplate.insert(doc));
        } catch (RuntimeException e) {
            releaseQuietly(jobId, executionId);
            throw e;
        }
        return Optional.of(new ExecutionToken(executionId, jobId, fireTime, startedAt));
    }

    @Override
    public ExecutionRecord complete(ExecutionToken token, ExecutionOutcome outcome, String error) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (!outcome.isFinal()) {
            throw new IllegalArgumentException("outcome must be final: " + outcome);
        }

        ExecutionRecord record = MongoCalls.call("complete", () -> {
            Query running = new Query(Criteria.where("_id").is(token.executionId())
                    .and("outcome").is(ExecutionOutcome.RUNNING));
            Update finish = new Update()
                    .set("finishedAt", now())
                    .set("outcome", outcome);
            if (error != null) {
                finish.set("error", error);
            }
            ExecutionRecordDocument doc = mongoTemplate.findAndModify(running, finish,
                    FindAndModifyOptions.options().returnNew(true), ExecutionRecordDocument.class);
            if (doc == null) {
                // already finalized, or never created
                doc = mongoTemplate.findById(token.executionId(), ExecutionRecordDocument.class);
            }
            if (doc == null) {
                throw new IllegalArgumentException("unknown execution: " + token.executionId());
            }
            return toRecord(doc);
        });

        MongoCalls.run("complete", () -> release(token.jobId(), token.executionId()));
        return record;
    }

    @Override
    public ExecutionRecord recordSkipped(String jobId, Instant fireTime) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Instant now = now();
        ExecutionRecordDocument doc = new ExecutionRecordDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setJobId(jobId);
        doc.setFireTime(fireTime);
        doc.setStartedAt(now);
        doc.setFinishedAt(now);
        doc.setOutcome(ExecutionOutcome.SKIPPED_DUPLICATE);
        doc.setOwnerId(ownerId);
        MongoCalls.run("recordSkipped", () -> mongoTemplate.insert(doc));
        return toRecord(doc);
    }

    @Override
    public Optional<ExecutionRecord> findRunning(String jobId) {
        return latest("findRunning", Criteria.where("jobId").is(jobId).and("outcome").is(ExecutionOutcome.RUNNING));
    }

    @Override
    public Optional<ExecutionRecord> findById(String executionId) {
        return MongoCalls.call("findById", () ->
                Optional.ofNullable(mongoTemplate.findById(executionId, ExecutionRecordDocument.class))
                        .map(MongoExecutionTracker::toRecord));
    }

    @Override
    public List<ExecutionRecord> history(String jobId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return MongoCalls.call("history", () -> {
            Query q = new Query(Criteria.where("jobId").is(jobId)).with(newestFirst()).limit(limit);
            return mongoTemplate.find(q, ExecutionRecordDocument.class).stream()
                    .map(MongoExecutionTracker::toRecord)
                    .toList();
        });
    }

    @Override
    public Optional<ExecutionRecord> lastCompleted(String jobId, ExecutionOutcome outcome) {
        return latest("lastCompleted", Criteria.where("jobId").is(jobId).and("outcome").is(outcome));
    }

    @Override
    public long deleteHistory(String jobId) {
        return MongoCalls.call("deleteHistory", () -> mongoTemplate.remove(
                new Query(Criteria.where("jobId").is(jobId).and("outcome").ne(ExecutionOutcome.RUNNING)),
                ExecutionRecordDocument.class).getDeletedCount());
    }

    @Override
    public int heartbeat(String ownerId, Instant now) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return MongoCalls.call("heartbeat", () -> (int) mongoTemplate.updateMulti(
                new Query(Criteria.where("ownerId").is(ownerId).and("outcome").is(ExecutionOutcome.RUNNING)),
                new Update().set(HEARTBEAT_AT, now),
                ExecutionRecordDocument.class).getModifiedCount());
    }

    /**
     * Each stale record is finalized with a conditional update that repeats the staleness check,
     * so a heartbeat landing in between keeps the run alive. Only the markers of finalized
     * records are released.
     */
    @Override
    public int recoverInterrupted(String currentOwnerId, Instant now, Duration staleAfter) {
        Objects.requireNonNull(currentOwnerId, "currentOwnerId must not be null");
        Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        Instant cutoff = now.minus(staleAfter);
        return MongoCalls.call("recoverInterrupted", () -> {
            Criteria stale = Criteria.where("outcome").is(ExecutionOutcome.RUNNING)
                    .and("ownerId").ne(currentOwnerId)
                    .and(HEARTBEAT_AT).lt(cutoff);
            List<ExecutionRecordDocument> orphans = mongoTemplate.find(new Query(stale), ExecutionRecordDocument.class);

            int recovered = 0;
            for (ExecutionRecordDocument orphan : orphans) {
                Query q = new Query(Criteria.where("_id").is(orphan.getId())
                        .and("outcome").is(ExecutionOutcome.RUNNING)
                        .and(HEARTBEAT_AT).lt(cutoff));
                Update u = new Update()
                        .set("finishedAt", now)
                        .set("outcome", ExecutionOutcome.FAILED)
                        .set("error", "interrupted: scheduler instance " + orphan.getOwnerId()
                                + " stopped heartbeating since " + orphan.getHeartbeatAt());
                if (mongoTemplate.updateFirst(q, u, ExecutionRecordDocument.class).getModifiedCount() > 0) {
                    release(orphan.getJobId(), orphan.getId());
                    recovered++;
                    log.debug("jobkeeper recovered interrupted execution id={} executionId={} owner={} heartbeatAt={}",
                            orphan.getJobId(), orphan.getId(), orphan.getOwnerId(), orphan.getHeartbeatAt());
                }
            }
            return recovered;
        });
    }

    private Optional<ExecutionRecord> latest(String operation, Criteria criteria) {
        return MongoCalls.call(operation, () -> {
            Query q = new Query(criteria).with(newestFirst()).limit(1);
            return Optional.ofNullable(mongoTemplate.findOne(q, ExecutionRecordDocument.class))
                    .map(MongoExecutionTracker::toRecord);
        });
    }

    /**
     * Clears the marker of one execution. A row left with neither marker nor schedule fields
     * belongs to a job removed during the run and is deleted.
     */
    private void release(String jobId, String executionId) {
        UpdateResult r = mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(jobId).and(ScheduleStateDocument.RUNNING_EXECUTION_ID).is(executionId)),
                clearMarker(),
                ScheduleStateDocument.class);
        if (r.getModifiedCount() > 0) {
            mongoTemplate.remove(new Query(Criteria.where("_id").is(jobId)
                    .and(ScheduleStateDocument.RUNNING_EXECUTION_ID).is(null)
                    .and(ScheduleStateDocument.MISFIRE_COUNT).exists(false)), ScheduleStateDocument.class);
        }
    }

    private void releaseQuietly(String jobId, String executionId) {
        try {
            MongoCalls.run("release", () -> release(jobId, executionId));
        } catch (RuntimeException e) {
            log.warn("jobkeeper could not release running marker id={} executionId={} msg={}",
                    jobId, executionId, e.getMessage());
        }
    }

    private static Update clearMarker() {
        return new Update()
                .unset(ScheduleStateDocument.RUNNING_EXECUTION_ID)
                .unset(ScheduleStateDocument.RUNNING_SINCE)
                .unset(ScheduleStateDocument.RUNNING_OWNER);
    }

    private static Sort newestFirst() {
        return Sort.by(Sort.Order.desc("startedAt"), Sort.Order.asc("_id"));
    }

    private static ExecutionRecord toRecord(ExecutionRecordDocument doc) {
        return new ExecutionRecord(
                doc.getId(),
                doc.getJobId(),
                doc.getFireTime(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getOutcome(),
                doc.getError(),
                doc.getOwnerId()
        );
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
