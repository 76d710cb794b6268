package io.jobkeeper.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.jobkeeper.core.ConflictException;
import io.jobkeeper.core.DueJob;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobFilter;
import io.jobkeeper.core.JobNotFoundException;
import io.jobkeeper.core.JobUpdate;
import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.core.ScheduleState;
import io.jobkeeper.spi.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MongoDB persistence layer for job definitions ({@code job_definitions}) and their schedule
 * state ({@code schedule_state}).
 *
 * <p>Definition updates are compare-and-swap writes on {@code version}: the update filter
 * carries the version the change was computed from, so a concurrent writer makes it match
 * nothing and the call fails with {@link ConflictException}. Schedule state writes by the loop
 * and the management API follow the same pattern on the state fields that were read.
 */
public class MongoJobStore implements JobStore {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Pings the server so that an unreachable database fails startup instead of the first tick.
     */
    @Override
    public void initialize() {
        MongoCalls.run("initialize", () -> mongoTemplate.executeCommand("{ ping: 1 }"));
    }

    @Override
    public String add(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        return MongoCalls.call("add", () -> {
            try {
                mongoTemplate.insert(toDocument(job));
            } catch (DuplicateKeyException e) {
                throw new ConflictException(job.id(), "job already exists: " + job.id());
            }
            return job.id();
        });
    }

    /**
     * Deletes the state row only when no run holds its marker. Otherwise just the schedule fields
     * are cleared and {@link MongoExecutionTracker#complete} deletes the row once the run ends,
     * so re-adding the same id cannot start a second run alongside it.
     */
    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return MongoCalls.call("remove", () -> {
            Query byId = new Query(Criteria.where("_id").is(id));
            long deleted = mongoTemplate.remove(byId, JobDefinitionDocument.class).getDeletedCount();
            Query idle = new Query(Criteria.where("_id").is(id).and(ScheduleStateDocument.RUNNING_EXECUTION_ID).is(null));
            if (mongoTemplate.remove(idle, ScheduleStateDocument.class).getDeletedCount() == 0) {
                Update clear = new Update()
                        .unset(ScheduleStateDocument.NEXT_FIRE_TIME)
                        .unset(ScheduleStateDocument.LAST_FIRE_TIME)
                        .unset(ScheduleStateDocument.MISFIRE_COUNT);
                mongoTemplate.updateFirst(byId, clear, ScheduleStateDocument.class);
                // the run may have completed in between and left an empty row behind
                mongoTemplate.remove(idle, ScheduleStateDocument.class);
            }
            return deleted > 0;
        });
    }

    @Override
    public JobDefinition update(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");

        return MongoCalls.call("update", () -> {
            JobDefinition current = findDefinition(id).orElseThrow(() -> new JobNotFoundException(id));
            if (update.expectedVersion() != null && update.expectedVersion() != current.version()) {
                throw new ConflictException(id, "stale version " + update.expectedVersion()
                        + " for job " + id + ", current is " + current.version());
            }

            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            JobDefinition next = update.applyTo(current).withVersion(current.version() + 1, now);

            Query q = new Query(Criteria.where("_id").is(id).and("version").is(current.version()));
            UpdateResult r = mongoTemplate.updateFirst(q, definitionUpdate(next), JobDefinitionDocument.class);
            if (r.getMatchedCount() == 0) {
                throw new ConflictException(id, "job was modified concurrently: " + id);
            }
            return next;
        });
    }

    @Override
    public Optional<JobDefinition> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return MongoCalls.call("get", () -> findDefinition(id));
    }

    @Override
    public List<JobDefinition> list(JobFilter filter) {
        JobFilter f = filter != null ? filter : JobFilter.all();
        return MongoCalls.call("list", () -> {
            Criteria c = new Criteria();
            if (f.enabled() != null) {
                c = c.and("enabled").is(f.enabled());
            }
            if (f.handler() != null) {
                c = c.and("handler").is(f.handler());
            }
            Query q = new Query(c).with(Sort.by(Sort.Order.asc("_id")));
            if (f.limit() != Integer.MAX_VALUE) {
                q.limit(Math.max(0, f.limit()));
            }
            return mongoTemplate.find(q, JobDefinitionDocument.class).stream()
                    .map(this::toDefinition)
                    .toList();
        });
    }

    @Override
    public Optional<ScheduleState> loadScheduleState(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return MongoCalls.call("loadScheduleState", () ->
                Optional.ofNullable(mongoTemplate.findById(id, ScheduleStateDocument.class))
                        .filter(doc -> doc.getMisfireCount() != null)
                        .map(MongoJobStore::toState));
    }

    /**
     * Upserts only the state fields, so a running marker on the same row is left untouched.
     */
    @Override
    public void saveScheduleState(String id, ScheduleState state) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(state, "state must not be null");

        Update u = new Update().set(ScheduleStateDocument.MISFIRE_COUNT, state.misfireCount());
        setOrUnset(u, ScheduleStateDocument.NEXT_FIRE_TIME, state.nextFireTime());
        setOrUnset(u, ScheduleStateDocument.LAST_FIRE_TIME, state.lastFireTime());

        MongoCalls.run("saveScheduleState", () ->
                mongoTemplate.upsert(new Query(Criteria.where("_id").is(id)), u, ScheduleStateDocument.class));
    }

    /**
     * Conditional update without upsert: the filter carries every field of {@code expected}, so
     * a concurrent write or a removed row makes it match nothing.
     */
    @Override
    public void replaceScheduleState(String id, ScheduleState expected, ScheduleState next) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");

        Query q = new Query(Criteria.where("_id").is(id)
                .and(ScheduleStateDocument.MISFIRE_COUNT).is(expected.misfireCount())
                .and(ScheduleStateDocument.NEXT_FIRE_TIME).is(expected.nextFireTime())
                .and(ScheduleStateDocument.LAST_FIRE_TIME).is(expected.lastFireTime()));
        Update u = new Update().set(ScheduleStateDocument.MISFIRE_COUNT, next.misfireCount());
        setOrUnset(u, ScheduleStateDocument.NEXT_FIRE_TIME, next.nextFireTime());
        setOrUnset(u, ScheduleStateDocument.LAST_FIRE_TIME, next.lastFireTime());

        UpdateResult r = MongoCalls.call("replaceScheduleState",
                () -> mongoTemplate.updateFirst(q, u, ScheduleStateDocument.class));
        if (r.getMatchedCount() == 0) {
            throw new ConflictException(id, "schedule state of job " + id + " was modified concurrently");
        }
    }

    /**
     * Due state rows are read most overdue first, then joined with their enabled definitions.
     */
    @Override
    public List<DueJob> findDue(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }

        return MongoCalls.call("findDue", () -> {
            Query dueQuery = new Query(Criteria.where(ScheduleStateDocument.NEXT_FIRE_TIME).ne(null).lte(now));
            dueQuery.with(Sort.by(Sort.Order.asc(ScheduleStateDocument.NEXT_FIRE_TIME), Sort.Order.asc("_id")));
            dueQuery.limit(limit);

            List<ScheduleStateDocument> states = mongoTemplate.find(dueQuery, ScheduleStateDocument.class);
            if (states.isEmpty()) {
                return List.of();
            }

            List<String> ids = new ArrayList<>(states.size());
            for (ScheduleStateDocument s : states) {
                ids.add(s.getId());
            }
            Query defsQuery = new Query(Criteria.where("_id").in(ids).and("enabled").is(true));
            Map<String, JobDefinition> defs = mongoTemplate.find(defsQuery, JobDefinitionDocument.class).stream()
                    .map(this::toDefinition)
                    .collect(Collectors.toMap(JobDefinition::id, Function.identity()));

            List<DueJob> due = new ArrayList<>(defs.size());
            for (ScheduleStateDocument s : states) {
                JobDefinition def = defs.get(s.getId());
                if (def != null) {
                    due.add(new DueJob(def, toState(s)));
                }
            }
            due.sort(Comparator.comparing(DueJob::id));
            return due;
        });
    }

    private Optional<JobDefinition> findDefinition(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, JobDefinitionDocument.class)).map(this::toDefinition);
    }

    private Update definitionUpdate(JobDefinition def) {
        ScheduleSpec s = def.schedule();
        Update u = new Update()
                .set("handler", def.handler())
                .set("scheduleKind", s.kind())
                .set("enabled", def.enabled())
                .set("updatedAt", def.updatedAt())
                .set("version", def.version());
        setOrUnset(u, "data", toStoredData(def.data()));
        setOrUnset(u, "expression", s.expression());
        setOrUnset(u, "timezone", s.timezone());
        setOrUnset(u, "startAt", s.startAt());
        setOrUnset(u, "endAt", s.endAt());
        return u;
    }

    private JobDefinitionDocument toDocument(JobDefinition def) {
        ScheduleSpec s = def.schedule();
        JobDefinitionDocument doc = new JobDefinitionDocument();
        doc.setId(def.id());
        doc.setHandler(def.handler());
        doc.setData(toStoredData(def.data()));
        doc.setScheduleKind(s.kind());
        doc.setExpression(s.expression());
        doc.setTimezone(s.timezone());
        doc.setStartAt(s.startAt());
        doc.setEndAt(s.endAt());
        doc.setEnabled(def.enabled());
        doc.setCreatedAt(def.createdAt());
        doc.setUpdatedAt(def.updatedAt());
        doc.setVersion(def.version());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobDefinition)}. The stored data map is converted back into
     * plain JSON types.
     */
    private JobDefinition toDefinition(JobDefinitionDocument doc) {
        return new JobDefinition(
                doc.getId(),
                doc.getHandler(),
                doc.getData() == null ? null : objectMapper.convertValue(doc.getData(), DATA_TYPE),
                new ScheduleSpec(doc.getScheduleKind(), doc.getExpression(), doc.getTimezone(),
                        doc.getStartAt(), doc.getEndAt()),
                doc.isEnabled(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getVersion()
        );
    }

    private Map<String, Object> toStoredData(Map<String, Object> data) {
        return data == null ? null : objectMapper.convertValue(data, DATA_TYPE);
    }

    private static ScheduleState toState(ScheduleStateDocument doc) {
        int misfires = doc.getMisfireCount() == null ? 0 : doc.getMisfireCount();
        return new ScheduleState(doc.getNextFireTime(), doc.getLastFireTime(), misfires);
    }

    private static void setOrUnset(Update u, String field, Object value) {
        if (value != null) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }
}
