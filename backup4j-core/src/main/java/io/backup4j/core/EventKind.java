package io.backup4j.core;

public enum EventKind {
    STATE_CHANGED,
    QUEUE_CHANGED,
    WORK_STARTED,
    WORK_COMPLETED,
    SCHEDULE_CHANGED,
    LIVE_CONTROL_CHANGED,
    BACKUP_CHANGED,
    NOTIFICATION
}
