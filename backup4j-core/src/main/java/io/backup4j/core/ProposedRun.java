package io.backup4j.core;

import java.time.Instant;

public record ProposedRun(String backupId, Instant time) {
}
