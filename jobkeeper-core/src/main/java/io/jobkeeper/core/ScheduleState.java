package io.jobkeeper.core;

import java.time.Instant;

/**
 * Mutable scheduling state of one job, written by the scheduler loop after each evaluation.
 *
 * @param nextFireTime null when the job is disabled or its schedule is exhausted
 * @param lastFireTime instant of the last dispatch, null before the first run
 * @param misfireCount number of dispatches that happened later than the misfire threshold
 */
public record ScheduleState(Instant nextFireTime, Instant lastFireTime, int misfireCount) {

    public static ScheduleState initial(Instant nextFireTime) {
        return new ScheduleState(nextFireTime, null, 0);
    }

    public ScheduleState withNextFireTime(Instant next) {
        return new ScheduleState(next, lastFireTime, misfireCount);
    }

    public boolean isDue(Instant now) {
        return nextFireTime != null && !nextFireTime.isAfter(now);
    }
}
