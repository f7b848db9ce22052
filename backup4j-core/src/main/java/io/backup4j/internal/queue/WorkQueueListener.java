package io.backup4j.internal.queue;

import io.backup4j.core.JobRequest;
import io.backup4j.core.RunState;

/**
 * Work queue observer. All callbacks run on the worker thread except {@link #onQueueChanged()},
 * {@link #onTaskRemoved(JobRequest)} and {@link #onStateChanged(RunState)}, which run on the caller's thread.
 */
public interface WorkQueueListener {

    default void onWorkStarting(JobRequest job) {
    }

    /**
     * @param error null when the job completed normally
     */
    default void onWorkCompleted(JobRequest job, Throwable error) {
    }

    default void onQueueChanged() {
    }

    /**
     * A pending job left the queue without running.
     */
    default void onTaskRemoved(JobRequest job) {
    }

    default void onStateChanged(RunState state) {
    }

    default void onError(JobRequest job, Throwable error) {
    }
}
