package io.jobkeeper;

import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobSpec;

import java.time.Duration;
import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Exactly one of {@code once}, {@code every}, {@code cron} or {@code dailyAt} must be called.
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + persist + compute the first fire time</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Stable job id. Defaults to the handler name.
     */
    JobBuilder id(String id);

    /**
     * IANA time zone id used by cron schedules (e.g. "Asia/Taipei"). Defaults to the system zone.
     */
    JobBuilder timezone(String timezone);

    /**
     * Run once at the given instant. An instant in the past runs on the next tick.
     */
    JobBuilder once(Instant time);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours", "30s") or plain seconds.
     */
    JobBuilder every(String interval);

    JobBuilder every(Duration interval);

    /**
     * Repeat on a cron expression (Quartz syntax with seconds, or 5-field unix syntax).
     */
    JobBuilder cron(String cron);

    /**
     * Repeat once a day at a local time ("HH:mm" or "HH:mm:ss") in the job's time zone.
     */
    JobBuilder dailyAt(String timeOfDay);

    /**
     * Anchor of interval schedules and earliest fire time of cron schedules.
     */
    JobBuilder startAt(Instant startAt);

    /**
     * No fire time after this instant is produced.
     */
    JobBuilder endAt(Instant endAt);

    /**
     * Make the first run due immediately instead of at the first computed fire time.
     */
    JobBuilder runImmediately();

    /**
     * Persist the job disabled; it does not fire until enabled.
     */
    JobBuilder disabled();

    /**
     * Update the job if one with the same id exists instead of failing.
     */
    JobBuilder replaceExisting();

    /**
     * Build an immutable job spec (not persisted).
     */
    JobSpec build();

    /**
     * Build + persist.
     */
    JobDefinition save();
}
