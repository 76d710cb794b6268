package io.jobkeeper.internal.mongo;

import io.jobkeeper.core.ExecutionOutcome;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for execution history. {@code finishedAt} is unset while running, so the
 * retention TTL index never removes a running record. {@code heartbeatAt} is refreshed by the
 * owning instance while the record is RUNNING.
 */
@Document(collection = "execution_records")
public class ExecutionRecordDocument {

    @Id
    private String id;

    private String jobId;
    private Instant fireTime;
    private Instant startedAt;
    private Instant finishedAt;
    private ExecutionOutcome outcome;
    private String error;
    private String ownerId;
    private Instant heartbeatAt;

    public ExecutionRecordDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Instant getFireTime() {
        return fireTime;
    }

    public void setFireTime(Instant fireTime) {
        this.fireTime = fireTime;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public ExecutionOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(ExecutionOutcome outcome) {
        this.outcome = outcome;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Instant getHeartbeatAt() {
        return heartbeatAt;
    }

    public void setHeartbeatAt(Instant heartbeatAt) {
        this.heartbeatAt = heartbeatAt;
    }
}
