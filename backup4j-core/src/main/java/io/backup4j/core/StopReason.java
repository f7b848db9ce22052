package io.backup4j.core;

/**
 * Why a running job was asked to stop.
 */
public enum StopReason {
    NONE("The operation was stopped"),
    USER_CLOSING("The operation was stopped by the user"),
    APPLICATION_EXIT("The application was closed while the operation was running"),
    TASK_MANAGER_CLOSING("The application was terminated by the task manager"),
    SHUTDOWN("The system was shut down while the operation was running");

    private final String message;

    StopReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * Aborts not caused by the user leave the backup to be resumed on the next launch.
     */
    public boolean initiatedBySystem() {
        return this == APPLICATION_EXIT || this == TASK_MANAGER_CLOSING || this == SHUTDOWN;
    }
}
