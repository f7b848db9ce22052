package io.backup4j.internal.schedule;

import io.backup4j.core.ScheduleComputationException;
import io.backup4j.utils.IntervalParser;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Set;

/**
 * Finds the next valid run time of a repeating schedule.
 * <p>
 * Starting at the base time, the interval is added until the result is not earlier than the lower
 * bound. If the weekday is not allowed, the search continues one day at a time for intervals of a
 * day or more (keeping the time of day), otherwise one interval at a time. Both loops are capped.
 */
public final class NextRunCalculator {

    public static final int DEFAULT_MAX_ITERATIONS = 50_000;

    private static final Duration ONE_DAY = Duration.ofDays(1);

    private final int maxIterations;

    public NextRunCalculator() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public NextRunCalculator(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.maxIterations = maxIterations;
    }

    public Instant nextValidTime(Instant base, Instant lowerBound, String repeat, Set<DayOfWeek> allowedDays, ZoneId zone) {
        return nextValidTime(null, base, lowerBound, repeat, allowedDays, zone);
    }

    /**
     * @param lowerBound the result is never earlier than this; null means no bound
     * @throws ScheduleComputationException if no allowed time is found within the cap
     * @throws IllegalArgumentException     if {@code repeat} cannot be parsed
     */
    public Instant nextValidTime(String scheduleId, Instant base, Instant lowerBound, String repeat,
                                 Set<DayOfWeek> allowedDays, ZoneId zone) {
        Instant res = base == null ? Instant.EPOCH : base;
        Instant bound = lowerBound == null ? res : lowerBound;

        int i = maxIterations;
        while (res.isBefore(bound) && i-- > 0) {
            res = IntervalParser.advance(repeat, res, zone);
        }

        if (!res.isBefore(bound) && !isDateAllowed(res, allowedDays, zone)) {
            if (IntervalParser.stepSize(repeat, res, zone).compareTo(ONE_DAY) >= 0) {
                int n = maxIterations;
                while (!isDateAllowed(res, allowedDays, zone) && n-- > 0) {
                    res = res.atZone(zone).plusDays(1).toInstant();
                }
            } else {
                i = maxIterations;
                while (!isDateAllowed(res, allowedDays, zone) && i-- > 0) {
                    res = IntervalParser.advance(repeat, res, zone);
                }
            }
        }

        if (res.isBefore(bound) || !isDateAllowed(res, allowedDays, zone)) {
            throw new ScheduleComputationException(scheduleId, base, repeat, allowedDays);
        }
        return res;
    }

    public static boolean isDateAllowed(Instant time, Set<DayOfWeek> allowedDays, ZoneId zone) {
        if (allowedDays == null || allowedDays.isEmpty()) {
            return true;
        }
        return allowedDays.contains(time.atZone(zone).getDayOfWeek());
    }
}
