package io.jobkeeper.internal;

import io.jobkeeper.JobBuilder;
import io.jobkeeper.core.JobDefinition;
import io.jobkeeper.core.JobSpec;
import io.jobkeeper.core.ScheduleKind;
import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.utils.IntervalParser;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String handler;
    private final Map<String, Object> data;
    private final Clock clock;
    private final Function<JobSpec, JobDefinition> persister;

    private String id;
    private String timezone;

    private ScheduleKind kind;
    private String expression;
    private Instant onceAt;
    private Instant startAt;
    private Instant endAt;

    private boolean enabled = true;
    private boolean runImmediately;
    private boolean replaceExisting;

    public SimpleJobBuilder(String handler, Map<String, Object> data, Clock clock,
                            Function<JobSpec, JobDefinition> persister) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        if (handler.isBlank()) {
            throw new IllegalArgumentException("handler must not be blank");
        }
        this.data = data;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder id(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        this.id = id;
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        this.timezone = IntervalParser.zoneOrDefault(timezone).getId();
        return this;
    }

    @Override
    public JobBuilder once(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        setKind(ScheduleKind.ONCE);
        this.onceAt = time;
        return this;
    }

    @Override
    public JobBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        IntervalParser.parseInterval(interval);
        setKind(ScheduleKind.INTERVAL);
        this.expression = interval.trim();
        return this;
    }

    @Override
    public JobBuilder every(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.toSeconds() <= 0 || interval.toNanos() % 1_000_000_000L != 0) {
            throw new IllegalArgumentException("interval must be a positive whole number of seconds");
        }
        return every(String.valueOf(interval.toSeconds()));
    }

    @Override
    public JobBuilder cron(String cron) {
        IntervalParser.requireCron(cron);
        setKind(ScheduleKind.CRON);
        this.expression = cron.trim();
        return this;
    }

    @Override
    public JobBuilder dailyAt(String timeOfDay) {
        String cron = IntervalParser.dailyCron(timeOfDay);
        setKind(ScheduleKind.CRON);
        this.expression = cron;
        return this;
    }

    @Override
    public JobBuilder startAt(Instant startAt) {
        this.startAt = Objects.requireNonNull(startAt, "startAt must not be null");
        return this;
    }

    @Override
    public JobBuilder endAt(Instant endAt) {
        this.endAt = Objects.requireNonNull(endAt, "endAt must not be null");
        return this;
    }

    @Override
    public JobBuilder runImmediately() {
        this.runImmediately = true;
        return this;
    }

    @Override
    public JobBuilder disabled() {
        this.enabled = false;
        return this;
    }

    @Override
    public JobBuilder replaceExisting() {
        this.replaceExisting = true;
        return this;
    }

    @Override
    public JobSpec build() {
        if (kind == null) {
            throw new IllegalStateException("No schedule configured for job " + (id != null ? id : handler)
                    + ": call once, every, cron or dailyAt");
        }
        return new JobSpec(
                id != null ? id : handler,
                handler,
                buildSchedule(),
                enabled,
                runImmediately,
                replaceExisting,
                data
        );
    }

    @Override
    public JobDefinition save() {
        return persister.apply(build());
    }

    private ScheduleSpec buildSchedule() {
        Instant end = millis(endAt);
        return switch (kind) {
            case ONCE -> new ScheduleSpec(ScheduleKind.ONCE, null, null, millis(onceAt), end);
            case INTERVAL -> new ScheduleSpec(ScheduleKind.INTERVAL, expression, null,
                    startAt != null ? millis(startAt) : millis(clock.instant()), end);
            case CRON -> new ScheduleSpec(ScheduleKind.CRON, expression,
                    timezone != null ? timezone : ZoneId.systemDefault().getId(), millis(startAt), end);
        };
    }

    private void setKind(ScheduleKind kind) {
        if (this.kind != null && this.kind != kind) {
            throw new IllegalStateException("Job schedule already set to " + this.kind + ", cannot also use " + kind);
        }
        this.kind = kind;
    }

    private static Instant millis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
