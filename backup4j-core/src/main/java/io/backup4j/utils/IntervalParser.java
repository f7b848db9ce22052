package io.backup4j.utils;

import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval expressions used by schedules, retention and pause requests.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "3600"</li>
 *   <li>Compact units, optionally chained: "1D", "1W", "2h30m". Units are
 *   {@code s}, {@code m} (minute), {@code h}, {@code D}, {@code W}, {@code M} (month) and {@code Y}.</li>
 *   <li>Human-readable intervals: "5 minutes", "1 day 3 hours"</li>
 *   <li>Cron expressions: "0 0 2 * * *" or the 5-field form</li>
 * </ul>
 * <p>
 * {@link #advance(String, Instant, ZoneId)} steps in calendar time of the given zone, so "1D" keeps
 * the wall clock time across a daylight saving change. {@link #parseDuration(String)} returns a
 * fixed approximation (a month is 30 days, a year 365 days).
 */
public final class IntervalParser {

    private static final Pattern COMPACT_TOKEN = Pattern.compile("(\\d+)\\s*([smhDdWwMYy])");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+\\s*[smhDdWwMYy]\\s*)+$");

    private IntervalParser() {
    }

    /**
     * Step {@code from} forward by one interval.
     *
     * @throws IllegalArgumentException if the expression is invalid or does not move time forward
     */
    public static Instant advance(String repeat, Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        String s = requireExpression(repeat);

        Instant next;
        if (!s.matches("^\\d+$") && !COMPACT.matcher(s).matches() && looksLikeCron(s)) {
            next = nextCronOccurrence(normalizeCron(s), zone, from);
        } else {
            ZonedDateTime z = from.atZone(zone);
            for (Step step : parseSteps(s)) {
                z = z.plus(step.amount(), step.unit());
            }
            next = z.toInstant();
        }

        if (!next.isAfter(from)) {
            throw new IllegalArgumentException("interval must be positive: " + repeat);
        }
        return next;
    }

    /**
     * The length of the interval that starts at {@code from}. Varies for calendar units and cron.
     */
    public static Duration stepSize(String repeat, Instant from, ZoneId zone) {
        return Duration.between(from, advance(repeat, from, zone));
    }

    /**
     * Parse an interval into a fixed duration. Zero is allowed, e.g. "0s".
     */
    public static Duration parseDuration(String expression) {
        String s = requireExpression(expression);
        if (!s.matches("^\\d+$") && !COMPACT.matcher(s).matches() && looksLikeCron(s)) {
            return parseCronDuration(normalizeCron(s), ZoneId.of("UTC"), Instant.now());
        }
        Duration total = Duration.ZERO;
        for (Step step : parseSteps(s)) {
            total = total.plus(approximate(step));
        }
        return total;
    }

    /**
     * Split a non-cron expression into calendar steps.
     */
    static List<Step> parseSteps(String expression) {
        String s = requireExpression(expression);

        if (s.matches("^\\d+$")) {
            try {
                return List.of(new Step(Long.parseLong(s), ChronoUnit.SECONDS));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("interval seconds out of range: " + expression);
            }
        }

        if (COMPACT.matcher(s).matches()) {
            List<Step> steps = new ArrayList<>();
            Set<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
            Matcher m = COMPACT_TOKEN.matcher(s);
            while (m.find()) {
                ChronoUnit unit = compactUnit(m.group(2).charAt(0));
                if (!seen.add(unit)) {
                    throw new IllegalArgumentException("Duplicate unit: " + m.group(2));
                }
                steps.add(new Step(parseAmount(m.group(1), expression), unit));
            }
            return steps;
        }

        return parseHumanSteps(s);
    }

    private static ChronoUnit compactUnit(char u) {
        return switch (u) {
            case 's' -> ChronoUnit.SECONDS;
            case 'm' -> ChronoUnit.MINUTES;
            case 'h' -> ChronoUnit.HOURS;
            case 'D', 'd' -> ChronoUnit.DAYS;
            case 'W', 'w' -> ChronoUnit.WEEKS;
            case 'M' -> ChronoUnit.MONTHS;
            case 'Y', 'y' -> ChronoUnit.YEARS;
            default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
        };
    }

    private static List<Step> parseHumanSteps(String input) {
        String s = input.toLowerCase(Locale.ROOT);
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        List<Step> steps = new ArrayList<>();
        Set<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseAmount(parts[i], input);

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            ChronoUnit chrono = switch (unit) {
                case "year" -> ChronoUnit.YEARS;
                case "month" -> ChronoUnit.MONTHS;
                case "week" -> ChronoUnit.WEEKS;
                case "day" -> ChronoUnit.DAYS;
                case "hour" -> ChronoUnit.HOURS;
                case "minute" -> ChronoUnit.MINUTES;
                case "second" -> ChronoUnit.SECONDS;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            };
            if (!seen.add(chrono)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            steps.add(new Step(n, chrono));
        }
        return steps;
    }

    private static long parseAmount(String digits, String expression) {
        long n;
        try {
            n = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + expression);
        }
        if (n < 0) {
            throw new IllegalArgumentException("Interval values must be non-negative");
        }
        return n;
    }

    private static Duration approximate(Step step) {
        return switch (step.unit()) {
            case MONTHS -> Duration.ofDays(30L * step.amount());
            case YEARS -> Duration.ofDays(365L * step.amount());
            default -> step.unit().getDuration().multipliedBy(step.amount());
        };
    }

    private static String requireExpression(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }
        return s;
    }

    /**
     * Normalize cron expressions:
     * - Accepts 6-field cron.
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String expression) {
        String s = requireExpression(expression);

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = dayOfWeek;
        if ("*".equals(dayOfMonth) && "*".equals(dow)) {
            dow = "?";
        }
        return String.join(" ", sec, min, hour, dayOfMonth, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String expression) {
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Compute duration from {@code from} to the next cron occurrence.
     */
    public static Duration parseCronDuration(String cron, ZoneId zone, Instant from) {
        return Duration.between(from, nextCronOccurrence(cron, zone, from));
    }

    private static Instant nextCronOccurrence(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(from));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return nextDate.toInstant();
    }

    record Step(long amount, ChronoUnit unit) {
    }
}
