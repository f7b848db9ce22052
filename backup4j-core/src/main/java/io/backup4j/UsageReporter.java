package io.backup4j;

/**
 * Receives engine failures for anonymous usage reporting.
 */
@FunctionalInterface
public interface UsageReporter {

    void report(Throwable error);

    static UsageReporter noop() {
        return error -> {
        };
    }
}
