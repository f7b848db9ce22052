package io.backup4j.core;

public enum ParsedResult {
    UNKNOWN,
    SUCCESS,
    WARNING,
    ERROR,
    FATAL
}
