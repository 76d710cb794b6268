package io.jobkeeper.config;

import io.jobkeeper.internal.mongo.ExecutionRecordDocument;
import io.jobkeeper.internal.mongo.JobDefinitionDocument;
import io.jobkeeper.internal.mongo.ScheduleStateDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Duration;
import java.util.Objects;

/**
 * MongoDB index definitions for the scheduler collections.
 *
 * <p><b>Important:</b> indexes are <b>not</b> created at startup unless
 * {@code jobkeeper.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_due</b> on {@code schedule_state}: { nextFireTime: 1 }
 *       <br/>Used by the loop to find due jobs.</li>
 *   <li><b>idx_enabled_handler</b> on {@code job_definitions}: { enabled: 1, handler: 1 }
 *       <br/>Used by list filters.</li>
 *   <li><b>idx_job_history</b> on {@code execution_records}: { jobId: 1, startedAt: -1 }
 *       <br/>Used by history, running lookup and last-success queries.</li>
 *   <li><b>ttl_finished</b> on {@code execution_records}: { finishedAt: 1 } with
 *       {@code expireAfterSeconds} = retention
 *       <br/>Expires finalized records. RUNNING records have no {@code finishedAt} and never expire.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_state.createIndex({ nextFireTime: 1 }, { name: "idx_due" });
 * db.job_definitions.createIndex({ enabled: 1, handler: 1 }, { name: "idx_enabled_handler" });
 * db.execution_records.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_history" });
 * db.execution_records.createIndex({ finishedAt: 1 }, { name: "ttl_finished", expireAfterSeconds: 2592000 });
 * </pre>
 */
public class JobKeeperMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(JobKeeperMongoIndexConfig.class);

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_ENABLED_HANDLER = "idx_enabled_handler";
    public static final String IDX_JOB_HISTORY = "idx_job_history";
    public static final String TTL_FINISHED = "ttl_finished";

    private final MongoTemplate mongoTemplate;
    private final Duration executionRetention;

    public JobKeeperMongoIndexConfig(MongoTemplate mongoTemplate, Duration executionRetention) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.executionRetention = Objects.requireNonNull(executionRetention, "executionRetention must not be null");
    }

    /**
     * Creates the indexes listed above. Safe to call repeatedly while the definitions are
     * unchanged; changing the retention of an existing TTL index requires dropping it first.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleStateDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(JobDefinitionDocument.class).ensureIndex(enabledHandlerIndex());
        mongoTemplate.indexOps(ExecutionRecordDocument.class).ensureIndex(jobHistoryIndex());
        mongoTemplate.indexOps(ExecutionRecordDocument.class).ensureIndex(finishedTtlIndex(executionRetention));
        log.info("jobkeeper mongo indexes ensured retention={}", executionRetention);
    }

    public static Index dueIndex() {
        return new Index()
                .on("nextFireTime", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    public static Index enabledHandlerIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("handler", Sort.Direction.ASC)
                .named(IDX_ENABLED_HANDLER);
    }

    public static Index jobHistoryIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_HISTORY);
    }

    /**
     * TTL index on {@code finishedAt}.
     *
     * @param retention how long finalized records are kept, at least one second
     */
    public static Index finishedTtlIndex(Duration retention) {
        if (retention.getSeconds() < 1) {
            throw new IllegalArgumentException("executionRetention must be at least one second");
        }
        return new Index()
                .on("finishedAt", Sort.Direction.ASC)
                .expire(retention)
                .named(TTL_FINISHED);
    }
}
