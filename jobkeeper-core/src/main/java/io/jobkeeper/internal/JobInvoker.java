package io.jobkeeper.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobkeeper.JobContext;
import io.jobkeeper.JobHandler;
import io.jobkeeper.core.ExecutionOutcome;
import io.jobkeeper.core.ExecutionRecord;
import io.jobkeeper.core.ExecutionToken;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobHandlerRegistry;
import io.jobkeeper.core.StoreUnavailableException;
import io.jobkeeper.spi.ExecutionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the handler of a job and runs it on the calling (worker) thread.
 */
class JobInvoker {
    private static final Logger log = LoggerFactory.getLogger(JobInvoker.class);

    private final JobHandlerRegistry registry;
    private final ExecutionTracker tracker;
    private final ObjectMapper objectMapper;

    JobInvoker(JobHandlerRegistry registry, ExecutionTracker tracker, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    void invoke(JobDefinition job, ExecutionToken token) throws Exception {
        JobHandler<?> handler = registry.getRequired(job.handler());
        JobContext context = new JobContext(
                job.id(),
                token.executionId(),
                token.fireTime(),
                token.startedAt(),
                lastSuccessAt(job.id())
        );
        execute(handler, job.data(), context);
    }

    private Instant lastSuccessAt(String jobId) {
        try {
            return tracker.lastCompleted(jobId, ExecutionOutcome.SUCCEEDED)
                    .map(ExecutionRecord::startedAt)
                    .orElse(null);
        } catch (StoreUnavailableException e) {
            log.warn("jobkeeper could not load last success id={} msg={}", jobId, e.getMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void execute(JobHandler<?> handler, Map<String, Object> rawData, JobContext context) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = (rawData == null) ? null : objectMapper.convertValue(rawData, h.dataClass());
        h.execute(data, context);
    }
}
