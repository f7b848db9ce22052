package io.backup4j.core;

import java.time.Instant;
import java.util.List;

/**
 * Factories for the non-backup operations a client can request.
 */
public final class JobRequests {

    private JobRequests() {
    }

    public static JobRequest restore(BackupDefinition backup, List<String> filters, Instant time,
                                     String restorePath, boolean overwrite, boolean restorePermissions,
                                     boolean skipMetadata) {
        JobRequest.Builder b = JobRequest.builder(OperationKind.RESTORE, backup)
                .filterStrings(filters)
                .extraOption("overwrite", Boolean.toString(overwrite))
                .extraOption("restore-permissions", Boolean.toString(restorePermissions))
                .extraOption("skip-metadata", Boolean.toString(skipMetadata));
        if (time != null) {
            b.extraOption("time", time.toString());
        }
        if (restorePath != null && !restorePath.isBlank()) {
            b.extraOption("restore-path", restorePath);
        }
        return b.build();
    }

    public static JobRequest list(BackupDefinition backup, List<String> filters, Instant time, boolean allVersions) {
        JobRequest.Builder b = JobRequest.builder(OperationKind.LIST, backup)
                .filterStrings(filters)
                .extraOption("all-versions", Boolean.toString(allVersions));
        if (time != null) {
            b.extraOption("time", time.toString());
        }
        return b.build();
    }

    public static JobRequest listFolderContents(BackupDefinition backup, List<String> folders, Instant time,
                                                int pageOffset, int pageSize) {
        JobRequest.Builder b = JobRequest.builder(OperationKind.LIST_FOLDER_CONTENTS, backup)
                .extraArguments(folders)
                .page(pageOffset, pageSize);
        if (time != null) {
            b.extraOption("time", time.toString());
        }
        return b.build();
    }

    public static JobRequest listFileVersions(BackupDefinition backup, List<String> files, int pageOffset, int pageSize) {
        return JobRequest.builder(OperationKind.LIST_FILE_VERSIONS, backup)
                .extraArguments(files)
                .page(pageOffset, pageSize)
                .build();
    }

    public static JobRequest searchEntries(BackupDefinition backup, List<String> filters, Instant time,
                                           int pageOffset, int pageSize) {
        JobRequest.Builder b = JobRequest.builder(OperationKind.SEARCH_ENTRIES, backup)
                .filterStrings(filters)
                .page(pageOffset, pageSize);
        if (time != null) {
            b.extraOption("time", time.toString());
        }
        return b.build();
    }

    public static JobRequest delete(BackupDefinition backup, boolean deleteRemoteFiles, boolean deleteLocalDb) {
        return JobRequest.builder(OperationKind.DELETE, backup)
                .extraOption("delete-remote-files", Boolean.toString(deleteRemoteFiles))
                .extraOption("delete-local-db", Boolean.toString(deleteLocalDb))
                .build();
    }

    public static JobRequest createReport(BackupDefinition backup, String reportPath) {
        return JobRequest.builder(OperationKind.CREATE_REPORT, backup)
                .extraArguments(List.of(reportPath))
                .build();
    }

    public static JobRequest maintenance(OperationKind operation, BackupDefinition backup) {
        return switch (operation) {
            case VERIFY, COMPACT, VACUUM, REPAIR, REPAIR_UPDATE, RECREATE_DATABASE, LIST_FILESETS, LIST_REMOTE, TEST_CONNECTION ->
                    JobRequest.builder(operation, backup).build();
            default -> throw new IllegalArgumentException("not a maintenance operation: " + operation);
        };
    }
}
