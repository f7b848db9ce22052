package io.backup4j.internal.runner;

import io.backup4j.core.EngineResult;
import io.backup4j.core.OperationKind;
import io.backup4j.utils.SizeParser;

import java.time.Instant;
import java.util.Map;

import static io.backup4j.core.BackupMetadata.*;

final class MetadataWriter {

    private MetadataWriter() {
    }

    static void apply(Map<String, String> metadata, OperationKind operation, EngineResult result) {
        if (result == null) {
            return;
        }

        if (operation == OperationKind.BACKUP && !result.interrupted()) {
            metadata.put(LAST_BACKUP_STARTED, format(result.beginTime()));
            metadata.put(LAST_BACKUP_FINISHED, format(result.endTime()));
            metadata.put(LAST_BACKUP_DURATION, result.duration().toString());
        }

        if (operation == OperationKind.BACKUP && result.backup() != null && !result.interrupted()) {
            metadata.put(SOURCE_FILES_SIZE, Long.toString(result.backup().sizeOfExaminedFiles()));
            metadata.put(SOURCE_FILES_COUNT, Long.toString(result.backup().examinedFiles()));
            metadata.put(SOURCE_SIZE_STRING, SizeParser.formatSize(result.backup().sizeOfExaminedFiles()));
        }

        if (operation == OperationKind.RESTORE && !result.interrupted()) {
            metadata.put(LAST_RESTORE_STARTED, format(result.beginTime()));
            metadata.put(LAST_RESTORE_FINISHED, format(result.endTime()));
            metadata.put(LAST_RESTORE_DURATION, result.duration().toString());
        }

        if (result.compact() != null) {
            metadata.put(LAST_COMPACT_STARTED, format(result.compact().beginTime()));
            metadata.put(LAST_COMPACT_FINISHED, format(result.compact().endTime()));
            metadata.put(LAST_COMPACT_DURATION, result.compact().duration().toString());
        }

        if (result.vacuum() != null) {
            metadata.put(LAST_VACUUM_STARTED, format(result.vacuum().beginTime()));
            metadata.put(LAST_VACUUM_FINISHED, format(result.vacuum().endTime()));
            metadata.put(LAST_VACUUM_DURATION, result.vacuum().duration().toString());
        }

        EngineResult.BackendStatistics backend = result.backend();
        if (backend != null) {
            if (backend.lastBackupDate() != null) {
                metadata.put(LAST_BACKUP_DATE, format(backend.lastBackupDate()));
            }
            metadata.put(BACKUP_LIST_COUNT, Long.toString(backend.backupListCount()));
            metadata.put(TOTAL_QUOTA_SPACE, Long.toString(backend.totalQuotaSpace()));
            metadata.put(FREE_QUOTA_SPACE, Long.toString(backend.freeQuotaSpace()));
            metadata.put(ASSIGNED_QUOTA_SPACE, Long.toString(backend.assignedQuotaSpace()));
            metadata.put(TARGET_FILES_SIZE, Long.toString(backend.knownFileSize()));
            metadata.put(TARGET_FILES_COUNT, Long.toString(backend.knownFileCount() + backend.unknownFileCount()));
            metadata.put(TARGET_SIZE_STRING, SizeParser.formatSize(backend.knownFileSize()));
        }
    }

    static void applyError(Map<String, String> metadata, Throwable error, Instant at) {
        metadata.put(LAST_ERROR_DATE, format(at));
        metadata.put(LAST_ERROR_MESSAGE, error == null || error.getMessage() == null
                ? String.valueOf(error)
                : error.getMessage());
    }

    private static String format(Instant instant) {
        return instant == null ? "" : instant.toString();
    }
}
