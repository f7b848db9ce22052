package io.backup4j.core;

import java.time.Instant;

/**
 * One entry of the scheduler's published plan.
 */
public record ScheduledRun(Instant time, ScheduleRecord schedule) {
}
