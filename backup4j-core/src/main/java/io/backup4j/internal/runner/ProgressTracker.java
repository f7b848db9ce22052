package io.backup4j.internal.runner;

import io.backup4j.ProgressSink;
import io.backup4j.core.JobRequest;
import io.backup4j.core.ProgressSnapshot;
import io.backup4j.core.ProgressUpdate;

/**
 * Keeps the latest progress of one job. While cleanup operations are still pending, every pending
 * operation reserves {@value #PERCENT_PER_EXTRA_OPERATION}% of the overall bar.
 */
public class ProgressTracker implements ProgressSink {

    static final int PERCENT_PER_EXTRA_OPERATION = 2;

    private final JobRequest job;

    private int pendingExtraOperations;
    private ProgressUpdate last;

    public ProgressTracker(JobRequest job, int pendingExtraOperations) {
        this.job = job;
        this.pendingExtraOperations = Math.max(0, pendingExtraOperations);
        this.last = ProgressUpdate.of("Started", 0);
    }

    @Override
    public synchronized void report(ProgressUpdate update) {
        if (update != null) {
            last = update;
        }
    }

    /**
     * A cleanup operation begins; its own progress is not tracked.
     */
    public synchronized void startExtraOperation(String phase) {
        if (pendingExtraOperations > 0) {
            pendingExtraOperations--;
        }
        last = ProgressUpdate.of(phase, 100);
    }

    public synchronized int pendingExtraOperations() {
        return pendingExtraOperations;
    }

    public synchronized ProgressSnapshot snapshot() {
        int progress = Math.max(0, Math.min(100, last.progress()));
        if (pendingExtraOperations > 0) {
            progress = (int) (progress / 100.0 * (100 - pendingExtraOperations * PERCENT_PER_EXTRA_OPERATION));
        }
        return new ProgressSnapshot(
                job.taskId(),
                job.backupId(),
                job.operation(),
                last.phase(),
                progress,
                last.message(),
                last.currentFilename(),
                last.processedFileCount(),
                last.processedFileSize(),
                last.totalFileCount(),
                last.totalFileSize(),
                last.stillCounting()
        );
    }
}
