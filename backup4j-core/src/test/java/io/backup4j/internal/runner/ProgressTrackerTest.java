package io.backup4j.internal.runner;

import io.backup4j.core.BackupDefinition;
import io.backup4j.core.JobRequest;
import io.backup4j.core.ProgressUpdate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProgressTrackerTest {

    private final JobRequest job = JobRequest.backup(BackupDefinition.of("b1", "Docs", "file:///x"));

    @Test
    void progressShouldLeaveRoomForPendingCleanups() {
        ProgressTracker tracker = new ProgressTracker(job, 2);

        tracker.report(ProgressUpdate.of("Backup_ProcessingFiles", 50));
        assertEquals(48, tracker.snapshot().overallProgress());

        tracker.report(ProgressUpdate.of("Backup_Complete", 100));
        assertEquals(96, tracker.snapshot().overallProgress());

        tracker.startExtraOperation("Cleaning up");
        assertEquals(98, tracker.snapshot().overallProgress());

        tracker.startExtraOperation("Cleaning up");
        assertEquals(100, tracker.snapshot().overallProgress());
        assertEquals(0, tracker.pendingExtraOperations());
    }

    @Test
    void progressShouldPassThroughWithoutCleanups() {
        ProgressTracker tracker = new ProgressTracker(job, 0);
        tracker.report(ProgressUpdate.of("Restore", 37));

        assertEquals(37, tracker.snapshot().overallProgress());
        assertEquals("b1", tracker.snapshot().backupId());
    }
}
