package io.backup4j;

import io.backup4j.core.ThreadPriority;

/**
 * Control surface of an in-flight engine operation.
 */
public interface EngineController {

    /**
     * Ask the operation to wind down at its next checkpoint.
     */
    void stop();

    /**
     * Terminate the operation without waiting for a checkpoint.
     */
    void abort();

    void pause();

    void resume();

    boolean isStopRequested();

    /**
     * @param uploadBytesPerSecond   0 means unlimited
     * @param downloadBytesPerSecond 0 means unlimited
     */
    void setThrottleSpeeds(long uploadBytesPerSecond, long downloadBytesPerSecond);

    /**
     * @param priority null clears a previous override
     */
    void setThreadPriority(ThreadPriority priority);
}
