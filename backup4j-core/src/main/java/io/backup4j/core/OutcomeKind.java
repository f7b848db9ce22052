package io.backup4j.core;

public enum OutcomeKind {
    OK,
    ABORTED_BY_USER,
    ABORTED_BY_SYSTEM,
    FAILED
}
