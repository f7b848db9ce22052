package io.backup4j;

/**
 * Raised when a directly invoked job fails inside the backup engine.
 * Queue-driven jobs never surface it; their failures are recorded as metadata and notifications.
 */
public class BackupExecutionException extends RuntimeException {

    private final String backupId;

    public BackupExecutionException(String message, String backupId, Throwable cause) {
        super(message, cause);
        this.backupId = backupId;
    }

    public String getBackupId() {
        return backupId;
    }
}
