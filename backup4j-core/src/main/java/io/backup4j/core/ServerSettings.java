package io.backup4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the scheduler, queue and event bus.
 *
 * @param maxScheduleWait    upper bound of one scheduler sleep
 * @param minScheduleWait    lower bound of one scheduler sleep
 * @param idleScheduleWait   sleep when no schedule is active
 * @param maxSearchIterations cap on the interval steps taken while looking for a next run
 * @param recentEventCapacity size of the event ring buffer
 * @param shutdownTimeout    how long {@code stop()} waits for the running job
 */
public record ServerSettings(
        Duration maxScheduleWait,
        Duration minScheduleWait,
        Duration idleScheduleWait,
        int maxSearchIterations,
        int recentEventCapacity,
        Duration shutdownTimeout
) {

    public ServerSettings {
        Objects.requireNonNull(maxScheduleWait, "maxScheduleWait must not be null");
        Objects.requireNonNull(minScheduleWait, "minScheduleWait must not be null");
        Objects.requireNonNull(idleScheduleWait, "idleScheduleWait must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        if (maxSearchIterations <= 0) {
            throw new IllegalArgumentException("maxSearchIterations must be positive");
        }
        if (recentEventCapacity <= 0) {
            throw new IllegalArgumentException("recentEventCapacity must be positive");
        }
    }

    public static ServerSettings defaults() {
        return new ServerSettings(
                Duration.ofMinutes(5),
                Duration.ofMillis(100),
                Duration.ofMinutes(1),
                50_000,
                100,
                Duration.ofSeconds(30)
        );
    }
}
