package io.backup4j.core;

/**
 * Progress of the active task as shown to clients.
 *
 * @param overallProgress already scaled for pending cleanup operations
 */
public record ProgressSnapshot(
        long taskId,
        String backupId,
        OperationKind operation,
        String phase,
        int overallProgress,
        String message,
        String currentFilename,
        long processedFileCount,
        long processedFileSize,
        long totalFileCount,
        long totalFileSize,
        boolean stillCounting
) {
}
