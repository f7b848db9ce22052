package io.backup4j;

import io.backup4j.core.ScheduleRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read access to persisted schedules plus the single write the scheduler performs.
 */
public interface ScheduleRepository {

    List<ScheduleRecord> listSchedules();

    /**
     * Resolve schedule tags to backup ids. A tag of the form {@code ID=<backupId>} names a backup directly.
     */
    List<String> findBackupIdsByTags(Collection<String> tags);

    void saveNextRun(String scheduleId, Instant nextRun, Instant lastRun);
}
