package io.jobkeeper.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for the schedule state of one job, keyed by job id.
 *
 * <p>The {@code running*} fields are the running marker owned by {@link MongoExecutionTracker};
 * {@link MongoJobStore} never writes them. A row whose job was removed while a run was in
 * progress keeps only the marker ({@code misfireCount} absent) and is deleted when that run
 * completes.
 */
@Document(collection = "schedule_state")
public class ScheduleStateDocument {

    static final String NEXT_FIRE_TIME = "nextFireTime";
    static final String LAST_FIRE_TIME = "lastFireTime";
    static final String MISFIRE_COUNT = "misfireCount";
    static final String RUNNING_EXECUTION_ID = "runningExecutionId";
    static final String RUNNING_SINCE = "runningSince";
    static final String RUNNING_OWNER = "runningOwner";

    @Id
    private String id;

    private Instant nextFireTime;
    private Instant lastFireTime;
    private Integer misfireCount;

    private String runningExecutionId;
    private Instant runningSince;
    private String runningOwner;

    public ScheduleStateDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public Instant getLastFireTime() {
        return lastFireTime;
    }

    public void setLastFireTime(Instant lastFireTime) {
        this.lastFireTime = lastFireTime;
    }

    public Integer getMisfireCount() {
        return misfireCount;
    }

    public void setMisfireCount(Integer misfireCount) {
        this.misfireCount = misfireCount;
    }

    public String getRunningExecutionId() {
        return runningExecutionId;
    }

    public void setRunningExecutionId(String runningExecutionId) {
        this.runningExecutionId = runningExecutionId;
    }

    public Instant getRunningSince() {
        return runningSince;
    }

    public void setRunningSince(Instant runningSince) {
        this.runningSince = runningSince;
    }

    public String getRunningOwner() {
        return runningOwner;
    }

    public void setRunningOwner(String runningOwner) {
        this.runningOwner = runningOwner;
    }
}
