package io.backup4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * No valid next run time was found within the search cap.
 */
public class ScheduleComputationException extends RuntimeException {

    private final String scheduleId;

    public ScheduleComputationException(String scheduleId, Instant base, String repeat, Set<DayOfWeek> allowedDays) {
        super("Failed to compute next run time: scheduleId=" + scheduleId
                + " base=" + base
                + " repeat=" + repeat
                + " allowedDays=" + (allowedDays == null || allowedDays.isEmpty() ? "ALL" : allowedDays));
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
