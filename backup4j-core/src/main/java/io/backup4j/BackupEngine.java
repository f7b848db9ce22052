package io.backup4j;

import io.backup4j.core.EngineRequest;

/**
 * The backup/restore engine. Treated as opaque: it scans, diffs, compresses, encrypts and uploads.
 *
 * <p>{@link #prepare(EngineRequest)} must be cheap; the slow, blocking work happens in
 * {@link EngineOperation#execute()}.
 */
public interface BackupEngine {

    EngineOperation prepare(EngineRequest request) throws Exception;
}
