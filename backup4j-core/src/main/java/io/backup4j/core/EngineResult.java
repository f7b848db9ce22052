package io.backup4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one engine operation. Statistics blocks are null when the operation did not produce them.
 *
 * @param payload operation specific data, e.g. listed entries
 */
public record EngineResult(
        ParsedResult parsedResult,
        Instant beginTime,
        Instant endTime,
        boolean interrupted,
        List<String> warnings,
        List<String> errors,
        BackupStatistics backup,
        BackendStatistics backend,
        MaintenanceRun compact,
        MaintenanceRun vacuum,
        String reportPath,
        Object payload
) {

    public EngineResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        parsedResult = parsedResult == null ? ParsedResult.UNKNOWN : parsedResult;
    }

    public static EngineResult success(Instant begin, Instant end) {
        return new EngineResult(ParsedResult.SUCCESS, begin, end, false, List.of(), List.of(),
                null, null, null, null, null, null);
    }

    public Duration duration() {
        if (beginTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(beginTime, endTime);
    }

    public EngineResult withParsedResult(ParsedResult value) {
        return new EngineResult(value, beginTime, endTime, interrupted, warnings, errors, backup, backend, compact, vacuum, reportPath, payload);
    }

    public EngineResult withInterrupted(boolean value) {
        return new EngineResult(parsedResult, beginTime, endTime, value, warnings, errors, backup, backend, compact, vacuum, reportPath, payload);
    }

    public EngineResult withWarnings(List<String> value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, value, errors, backup, backend, compact, vacuum, reportPath, payload);
    }

    public EngineResult withErrors(List<String> value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, value, backup, backend, compact, vacuum, reportPath, payload);
    }

    public EngineResult withBackup(BackupStatistics value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, value, backend, compact, vacuum, reportPath, payload);
    }

    public EngineResult withBackend(BackendStatistics value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, backup, value, compact, vacuum, reportPath, payload);
    }

    public EngineResult withCompact(MaintenanceRun value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, backup, backend, value, vacuum, reportPath, payload);
    }

    public EngineResult withVacuum(MaintenanceRun value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, backup, backend, compact, value, reportPath, payload);
    }

    public EngineResult withReportPath(String value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, backup, backend, compact, vacuum, value, payload);
    }

    public EngineResult withPayload(Object value) {
        return new EngineResult(parsedResult, beginTime, endTime, interrupted, warnings, errors, backup, backend, compact, vacuum, reportPath, value);
    }

    public record BackupStatistics(long examinedFiles, long sizeOfExaminedFiles, long filesWithError) {
    }

    public record BackendStatistics(
            Instant lastBackupDate,
            long backupListCount,
            long totalQuotaSpace,
            long freeQuotaSpace,
            long assignedQuotaSpace,
            long knownFileSize,
            long knownFileCount,
            long unknownFileCount
    ) {
    }

    public record MaintenanceRun(Instant beginTime, Instant endTime) {

        public Duration duration() {
            return beginTime == null || endTime == null ? Duration.ZERO : Duration.between(beginTime, endTime);
        }
    }
}
