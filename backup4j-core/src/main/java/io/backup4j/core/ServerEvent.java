package io.backup4j.core;

import java.time.Instant;

/**
 * @param subject optional id of what changed, e.g. a backup id
 */
public record ServerEvent(long id, EventKind kind, String subject, Instant at) {
}
