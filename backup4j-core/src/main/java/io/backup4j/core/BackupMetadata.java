package io.backup4j.core;

/**
 * Metadata keys written to a backup definition after each run.
 */
public final class BackupMetadata {

    public static final String LAST_BACKUP_STARTED = "LastBackupStarted";
    public static final String LAST_BACKUP_FINISHED = "LastBackupFinished";
    public static final String LAST_BACKUP_DURATION = "LastBackupDuration";
    public static final String SOURCE_FILES_SIZE = "SourceFilesSize";
    public static final String SOURCE_FILES_COUNT = "SourceFilesCount";
    public static final String SOURCE_SIZE_STRING = "SourceSizeString";

    public static final String LAST_RESTORE_STARTED = "LastRestoreStarted";
    public static final String LAST_RESTORE_FINISHED = "LastRestoreFinished";
    public static final String LAST_RESTORE_DURATION = "LastRestoreDuration";

    public static final String LAST_COMPACT_STARTED = "LastCompactStarted";
    public static final String LAST_COMPACT_FINISHED = "LastCompactFinished";
    public static final String LAST_COMPACT_DURATION = "LastCompactDuration";

    public static final String LAST_VACUUM_STARTED = "LastVacuumStarted";
    public static final String LAST_VACUUM_FINISHED = "LastVacuumFinished";
    public static final String LAST_VACUUM_DURATION = "LastVacuumDuration";

    public static final String LAST_BACKUP_DATE = "LastBackupDate";
    public static final String BACKUP_LIST_COUNT = "BackupListCount";
    public static final String TOTAL_QUOTA_SPACE = "TotalQuotaSpace";
    public static final String FREE_QUOTA_SPACE = "FreeQuotaSpace";
    public static final String ASSIGNED_QUOTA_SPACE = "AssignedQuotaSpace";
    public static final String TARGET_FILES_SIZE = "TargetFilesSize";
    public static final String TARGET_FILES_COUNT = "TargetFilesCount";
    public static final String TARGET_SIZE_STRING = "TargetSizeString";

    public static final String LAST_ERROR_DATE = "LastErrorDate";
    public static final String LAST_ERROR_MESSAGE = "LastErrorMessage";

    public static final String LAST_ABORT_DATE = "LastAbortDate";
    public static final String LAST_ABORT_REASON = "LastAbortReason";
    public static final String RESUME_ON_NEXT_LAUNCH = "ResumeOnNextLaunch";
    public static final String BACKUP_IN_PROGRESS = "BackupInProgress";

    private BackupMetadata() {
    }
}
