package io.backup4j;

import io.backup4j.core.ProgressUpdate;

/**
 * Receives progress from a running engine operation. Called from the engine's threads.
 */
@FunctionalInterface
public interface ProgressSink {

    void report(ProgressUpdate update);
}
