package io.backup4j.internal.live;

import io.backup4j.core.RunState;
import io.backup4j.core.ThreadPriority;

/**
 * Callbacks are invoked while the live control lock is held; implementations must not block.
 */
public interface LiveControlListener {

    default void onStateChanged(RunState state) {
    }

    default void onThreadPriorityChanged(ThreadPriority priority) {
    }

    default void onThrottleSpeedChanged(Long uploadLimit, Long downloadLimit) {
    }
}
