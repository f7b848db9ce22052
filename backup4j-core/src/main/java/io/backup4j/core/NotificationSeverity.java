package io.backup4j.core;

public enum NotificationSeverity {
    INFORMATION,
    WARNING,
    ERROR
}
