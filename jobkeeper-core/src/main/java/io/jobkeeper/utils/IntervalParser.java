package io.jobkeeper.utils;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

import org.quartz.CronExpression;

/**
 * Parses and validates schedule expressions.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours"</li>
 *   <li>Compact intervals: "30s", "15m", "2h", "1d", "1w"</li>
 *   <li>Plain seconds: "90"</li>
 *   <li>Cron expressions in Quartz syntax (6 or 7 fields, seconds first) or the 5-field unix form</li>
 * </ul>
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Parse an interval expression into a strictly positive {@link Duration}.
     */
    public static Duration parseInterval(String spec) {
        Objects.requireNonNull(spec, "interval must not be null");
        Duration d = parseHumanDuration(spec);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + spec);
        }
        return d;
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5-field cron gets a leading seconds field "0".
     * - Quartz needs '?' in exactly one of day-of-month/day-of-week; a '*' in one of them
     *   becomes '?' when the other is restricted, day-of-week becomes '?' when both are '*'.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("cron must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
        }
        if (parts.length == 7) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth,
                                       String month, String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom) && !"?".equals(dow)) {
            dom = "?";
        } else if ("*".equals(dow) && !"?".equals(dom)) {
            dow = "?";
        }

        String cron = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? cron : cron + " " + year;
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression} after normalization.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Validate and normalize a cron expression.
     *
     * @throws IllegalArgumentException if the expression is not valid cron
     */
    public static String requireCron(String spec) {
        String cron = normalizeCron(spec);
        try {
            CronExpression.validateExpression(cron);
        } catch (java.text.ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression '" + spec + "': " + ex.getMessage());
        }
        return cron;
    }

    /**
     * Cron expression firing once a day at the given local time ("HH:mm" or "HH:mm:ss").
     */
    public static String dailyCron(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        LocalTime lt;
        try {
            lt = LocalTime.parse(timeOfDay.trim());
        } catch (Exception ex) {
            throw new IllegalArgumentException("Invalid timeOfDay. Expected HH:mm or HH:mm:ss: " + timeOfDay);
        }
        return lt.getSecond() + " " + lt.getMinute() + " " + lt.getHour() + " * * ?";
    }

    /**
     * Resolve an IANA zone id, falling back to the system default when null.
     */
    public static ZoneId zoneOrDefault(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (Exception ex) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone);
        }
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            // months are left out: a calendar month is not a fixed duration, use cron instead
            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds += ChronoUnit.WEEKS.getDuration().toSeconds() * n;
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * n;
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds += ChronoUnit.HOURS.getDuration().toSeconds() * n;
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds += ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds += n;
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }
}
