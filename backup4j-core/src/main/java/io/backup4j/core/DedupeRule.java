package io.backup4j.core;

/**
 * How a notification store treats an earlier notification for the same backup.
 */
public enum DedupeRule {
    /** Always append. */
    NONE,
    /** Replace any earlier notification for the backup. */
    REPLACE_SAME_BACKUP,
    /** Replace, unless the earlier notification is an error. */
    KEEP_EXISTING_ERROR
}
