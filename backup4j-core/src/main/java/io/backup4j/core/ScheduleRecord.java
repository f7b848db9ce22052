package io.backup4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A persisted schedule.
 *
 * @param tags        target selectors; {@code ID=<backupId>} names one backup directly
 * @param repeat      interval expression, blank disables the schedule
 * @param allowedDays empty means every day
 * @param time        next run time (UTC)
 * @param lastRun     last run time (UTC), may be null
 */
public record ScheduleRecord(
        String id,
        List<String> tags,
        String repeat,
        Set<DayOfWeek> allowedDays,
        Instant time,
        Instant lastRun
) {

    public static final String ID_TAG_PREFIX = "ID=";

    public ScheduleRecord {
        Objects.requireNonNull(id, "id must not be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        allowedDays = allowedDays == null || allowedDays.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(allowedDays));
        time = time == null ? Instant.EPOCH : time;
    }

    public boolean isActive() {
        return repeat != null && !repeat.isBlank();
    }

    public ScheduleRecord withRun(Instant nextTime, Instant lastRunTime) {
        return new ScheduleRecord(id, tags, repeat, allowedDays, nextTime, lastRunTime);
    }

    /**
     * Backup ids named directly by {@code ID=} tags.
     */
    public List<String> directBackupIds() {
        return tags.stream()
                .filter(t -> t.startsWith(ID_TAG_PREFIX))
                .map(t -> t.substring(ID_TAG_PREFIX.length()))
                .toList();
    }
}
