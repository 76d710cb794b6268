package io.jobkeeper.trigger;

import io.jobkeeper.core.ScheduleSpec;
import io.jobkeeper.utils.IntervalParser;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Computes fire times from a {@link ScheduleSpec}. Pure: no clock, no I/O.
 *
 * <p>Cron expressions are matched against wall-clock time in the schedule's zone and the
 * matching local time is then mapped to an instant:
 * <ul>
 *   <li>a local time that occurs twice (DST fall-back) maps to the earlier instant, and the
 *       repeated wall-clock period does not fire again</li>
 *   <li>a local time that does not exist (DST gap) is shifted later by the length of the gap</li>
 * </ul>
 */
public final class TriggerEvaluator {

    private static final TimeZone WALL_CLOCK = TimeZone.getTimeZone("UTC");

    // a second-level cron inside a one hour DST overlap needs 3600 candidates at most
    private static final int MAX_CRON_CANDIDATES = 10_000;

    private TriggerEvaluator() {
    }

    /**
     * Earliest fire time strictly after {@code after}, or empty when the schedule has no
     * further occurrence.
     */
    public static Optional<Instant> nextFireTime(ScheduleSpec spec, Instant after) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(after, "after must not be null");

        Optional<Instant> next = switch (spec.kind()) {
            case ONCE -> spec.startAt().isAfter(after) ? Optional.of(spec.startAt()) : Optional.empty();
            case INTERVAL -> Optional.of(nextInterval(spec, after));
            case CRON -> nextCron(spec, after);
        };

        if (spec.endAt() != null && next.isPresent() && next.get().isAfter(spec.endAt())) {
            return Optional.empty();
        }
        return next;
    }

    /**
     * Fire time used when a job is registered or re-enabled at {@code now}.
     *
     * <p>A one-shot whose instant already passed still fires once; recurring schedules start
     * with their next occurrence after {@code now}.
     */
    public static Optional<Instant> firstFireTime(ScheduleSpec spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (!spec.kind().isRecurring()) {
            if (spec.endAt() != null && spec.startAt().isAfter(spec.endAt())) {
                return Optional.empty();
            }
            return Optional.of(spec.startAt());
        }
        return nextFireTime(spec, now);
    }

    private static Instant nextInterval(ScheduleSpec spec, Instant after) {
        Duration step = IntervalParser.parseInterval(spec.expression());
        Instant anchor = spec.startAt();
        if (after.isBefore(anchor)) {
            return anchor;
        }
        long elapsedMillis = Duration.between(anchor, after).toMillis();
        long periods = elapsedMillis / step.toMillis() + 1;
        return anchor.plus(step.multipliedBy(periods));
    }

    private static Optional<Instant> nextCron(ScheduleSpec spec, Instant after) {
        CronExpression expression = compile(spec.expression());
        ZoneId zone = IntervalParser.zoneOrDefault(spec.timezone());

        Instant reference = after;
        if (spec.startAt() != null && reference.isBefore(spec.startAt())) {
            reference = spec.startAt().minusNanos(1);
        }

        LocalDateTime cursor = LocalDateTime.ofInstant(reference, zone);
        for (int i = 0; i < MAX_CRON_CANDIDATES; i++) {
            Date match = expression.getNextValidTimeAfter(Date.from(cursor.toInstant(ZoneOffset.UTC)));
            if (match == null) {
                return Optional.empty();
            }
            LocalDateTime local = LocalDateTime.ofInstant(match.toInstant(), ZoneOffset.UTC);
            Instant candidate = ZonedDateTime.ofLocal(local, zone, null).toInstant();
            if (candidate.isAfter(reference)) {
                return Optional.of(candidate);
            }
            cursor = local;
        }
        throw new IllegalStateException("No cron fire time found after " + after + " for '" + spec.expression() + "'");
    }

    private static CronExpression compile(String cron) {
        try {
            CronExpression expression = new CronExpression(IntervalParser.normalizeCron(cron));
            expression.setTimeZone(WALL_CLOCK);
            return expression;
        } catch (ParseException | RuntimeException ex) {
            throw new IllegalArgumentException("Invalid cron expression '" + cron + "': " + ex.getMessage());
        }
    }
}
