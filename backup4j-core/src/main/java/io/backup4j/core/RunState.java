package io.backup4j.core;

public enum RunState {
    RUNNING,
    PAUSED
}
