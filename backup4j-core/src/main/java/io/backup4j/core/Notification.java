package io.backup4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A user-visible message produced by a run.
 *
 * @param exception rendered exception text, may be null
 * @param action    optional client action hint, e.g. {@code backup:show-log}
 * @param messageId optional stable identifier of the message kind
 */
public record Notification(
        NotificationSeverity severity,
        String title,
        String message,
        String exception,
        String backupId,
        String action,
        String messageId,
        DedupeRule dedupeRule,
        Instant createdAt
) {

    public Notification {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(title, "title must not be null");
        dedupeRule = dedupeRule == null ? DedupeRule.NONE : dedupeRule;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Notification info(String title, String message, String backupId, Instant at) {
        return new Notification(NotificationSeverity.INFORMATION, title, message, null, backupId, null, null, DedupeRule.NONE, at);
    }
}
