package io.backup4j.core;

public enum JobState {
    CREATED,
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }
}
