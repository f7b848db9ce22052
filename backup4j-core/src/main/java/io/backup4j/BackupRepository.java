package io.backup4j;

import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;

import java.util.List;
import java.util.Map;

/**
 * Persisted backup definitions, their run metadata and the global application settings.
 */
public interface BackupRepository {

    BackupDefinition findBackup(String backupId);

    List<BackupDefinition> listBackups();

    ApplicationSettings applicationSettings();

    /**
     * Replace the metadata of a backup.
     */
    void saveMetadata(String backupId, Map<String, String> metadata);

    /**
     * Durably flag a backup as running, so an abrupt exit can be reported on the next start.
     */
    void markInProgress(String backupId, String message);

    void clearInProgress(String backupId);

    void deleteBackup(String backupId);
}
