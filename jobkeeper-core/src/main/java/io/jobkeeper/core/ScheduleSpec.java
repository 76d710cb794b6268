package io.jobkeeper.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable schedule specification of a job.
 *
 * <ul>
 *   <li>ONCE: fires at {@code startAt}; {@code expression} is null</li>
 *   <li>INTERVAL: fires every {@code expression} (e.g. "5 minutes") counted from {@code startAt}</li>
 *   <li>CRON: fires on calendar matches of {@code expression}, evaluated in {@code timezone},
 *       never before {@code startAt} when present</li>
 * </ul>
 *
 * <p>{@code endAt}, when set, bounds every kind: no fire time after it is produced.
 */
public record ScheduleSpec(
        ScheduleKind kind,
        String expression,
        String timezone,
        Instant startAt,
        Instant endAt
) {
    public ScheduleSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == ScheduleKind.ONCE && startAt == null) {
            throw new IllegalArgumentException("ONCE schedule requires startAt");
        }
        if (kind == ScheduleKind.INTERVAL && startAt == null) {
            throw new IllegalArgumentException("INTERVAL schedule requires an anchor (startAt)");
        }
        if (kind != ScheduleKind.ONCE && (expression == null || expression.isBlank())) {
            throw new IllegalArgumentException(kind + " schedule requires an expression");
        }
        if (kind == ScheduleKind.CRON && (timezone == null || timezone.isBlank())) {
            throw new IllegalArgumentException("CRON schedule requires a timezone");
        }
        if (startAt != null && endAt != null && endAt.isBefore(startAt)) {
            throw new IllegalArgumentException("endAt must not be before startAt");
        }
    }

    public static ScheduleSpec once(Instant at) {
        return new ScheduleSpec(ScheduleKind.ONCE, null, null, at, null);
    }

    public static ScheduleSpec interval(String interval, Instant anchor) {
        return new ScheduleSpec(ScheduleKind.INTERVAL, interval, null, anchor, null);
    }

    public static ScheduleSpec cron(String cron, String timezone) {
        return new ScheduleSpec(ScheduleKind.CRON, cron, timezone, null, null);
    }

    public ScheduleSpec withEndAt(Instant endAt) {
        return new ScheduleSpec(kind, expression, timezone, startAt, endAt);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ONCE -> "once@" + startAt;
            case INTERVAL -> "every " + expression + " from " + startAt;
            case CRON -> "cron '" + expression + "' " + timezone;
        };
    }
}
