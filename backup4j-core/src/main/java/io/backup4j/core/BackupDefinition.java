package io.backup4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A stored backup configuration as read from the backup repository.
 *
 * @param keepFull number of full backups to keep after each run, 0 disables the cleanup
 * @param keepTime retention interval expression, blank disables the cleanup
 */
public record BackupDefinition(
        String id,
        String name,
        String targetUrl,
        List<String> sources,
        List<SettingEntry> settings,
        List<FilterRule> filters,
        Map<String, String> metadata,
        String dbPath,
        int keepFull,
        String keepTime,
        boolean temporary
) {

    public BackupDefinition {
        Objects.requireNonNull(id, "id must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
        settings = settings == null ? List.of() : List.copyOf(settings);
        filters = filters == null ? List.of() : List.copyOf(filters);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BackupDefinition of(String id, String name, String targetUrl) {
        return new BackupDefinition(id, name, targetUrl, List.of(), List.of(), List.of(), Map.of(), null, 0, null, false);
    }

    public BackupDefinition withMetadata(Map<String, String> values) {
        return new BackupDefinition(id, name, targetUrl, sources, settings, filters, values, dbPath, keepFull, keepTime, temporary);
    }

    public BackupDefinition withSettings(List<SettingEntry> values) {
        return new BackupDefinition(id, name, targetUrl, sources, values, filters, metadata, dbPath, keepFull, keepTime, temporary);
    }

    public BackupDefinition withRetention(int full, String time) {
        return new BackupDefinition(id, name, targetUrl, sources, settings, filters, metadata, dbPath, full, time, temporary);
    }

    public int pendingCleanups() {
        int count = 0;
        if (keepFull > 0) {
            count++;
        }
        if (keepTime != null && !keepTime.isBlank()) {
            count++;
        }
        return count;
    }
}
