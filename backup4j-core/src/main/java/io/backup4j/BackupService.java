package io.backup4j;

import io.backup4j.core.JobRequest;
import io.backup4j.core.ServerEvent;
import io.backup4j.core.ServerState;
import io.backup4j.core.StopReason;
import io.backup4j.core.ThreadPriority;
import io.backup4j.core.EngineResult;

import java.time.Duration;
import java.util.List;

/**
 * Main backup scheduling API.
 *
 * <p>Owns one scheduler thread and one worker thread. Scheduled backups and caller-submitted
 * jobs share the same single-worker queue, so at most one engine operation runs at a time.
 *
 * <p>Typical usage:
 * <pre>{@code
 * service.start();
 *
 * service.runNow("42");
 * service.pause(Duration.ofMinutes(10));
 *
 * long seen = service.currentState().lastEventId();
 * seen = service.waitForEvent(seen, Duration.ofSeconds(30));
 *
 * service.stop();
 * }</pre>
 */
public interface BackupService {

    void start();

    void stop();

    /**
     * Wakes the scheduler so it re-reads schedules immediately.
     * Call this after a schedule or backup definition was edited.
     */
    void reschedule();

    /**
     * Append a job to the work queue.
     */
    JobRequest enqueue(JobRequest job);

    /**
     * Queue a backup of the given definition.
     *
     * @throws IllegalArgumentException if no such backup exists
     */
    JobRequest runNow(String backupId);

    /**
     * Run a job on the calling thread, bypassing the queue.
     * Engine failures are rethrown as {@link BackupExecutionException}.
     */
    EngineResult runDirect(JobRequest job);

    void pause();

    void pause(Duration duration);

    void resume();

    void setThreadPriority(ThreadPriority priority);

    void setUploadLimit(Long bytesPerSecond);

    void setDownloadLimit(Long bytesPerSecond);

    /**
     * Request a graceful stop of the running job. A second call escalates to an abort.
     */
    void stopCurrent(StopReason reason);

    void abortCurrent(StopReason reason);

    void clearQueue(boolean stopCurrent);

    ServerState currentState();

    /**
     * Long-poll for a state change.
     *
     * @return the current event id; equal to {@code lastKnownId} only when the timeout elapsed
     */
    long waitForEvent(long lastKnownId, Duration timeout) throws InterruptedException;

    List<ServerEvent> recentEvents(long sinceId);
}
