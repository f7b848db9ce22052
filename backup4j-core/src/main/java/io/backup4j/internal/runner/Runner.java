package io.backup4j.internal.runner;

import io.backup4j.BackupEngine;
import io.backup4j.BackupExecutionException;
import io.backup4j.BackupRepository;
import io.backup4j.EngineOperation;
import io.backup4j.NotificationSink;
import io.backup4j.UsageReporter;
import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.BackupMetadata;
import io.backup4j.core.DedupeRule;
import io.backup4j.core.EngineOutcome;
import io.backup4j.core.EngineRequest;
import io.backup4j.core.EngineResult;
import io.backup4j.core.EventKind;
import io.backup4j.core.FilterRule;
import io.backup4j.core.JobRequest;
import io.backup4j.core.JobState;
import io.backup4j.core.Notification;
import io.backup4j.core.NotificationSeverity;
import io.backup4j.core.OperationKind;
import io.backup4j.core.OutcomeKind;
import io.backup4j.core.ParsedResult;
import io.backup4j.core.ProgressSnapshot;
import io.backup4j.internal.events.EventBus;
import io.backup4j.internal.live.LiveControls;
import io.backup4j.utils.SizeParser;
import io.backup4j.utils.SpecialFolders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executes one job against the engine and records what happened.
 * <p>
 * Successful runs update the backup's metadata and may raise warning or error notifications.
 * Failed runs record {@code LastErrorDate}/{@code LastErrorMessage}, raise an error notification and
 * report the exception; they are rethrown only for direct (non-queue) invocations.
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    static final String IN_PROGRESS_MESSAGE = "shutdown while backup in progress";

    private static final Set<OperationKind> READ_ONLY = EnumSet.of(
            OperationKind.LIST,
            OperationKind.LIST_FILESETS,
            OperationKind.LIST_FOLDER_CONTENTS,
            OperationKind.LIST_FILE_VERSIONS,
            OperationKind.SEARCH_ENTRIES,
            OperationKind.LIST_REMOTE,
            OperationKind.TEST_CONNECTION
    );

    private final BackupRepository backups;
    private final BackupEngine engine;
    private final NotificationSink notifications;
    private final UsageReporter usageReporter;
    private final EventBus eventBus;
    private final LiveControls liveControls;
    private final SpecialFolders specialFolders;
    private final TaskConfigExporter taskConfigExporter;
    private final Clock clock;
    private final EngineInvoker invoker = new EngineInvoker();

    private volatile ProgressTracker activeProgress;
    private volatile ProgressSnapshot lastProgress;

    public Runner(BackupRepository backups, BackupEngine engine, NotificationSink notifications,
                  UsageReporter usageReporter, EventBus eventBus, LiveControls liveControls,
                  SpecialFolders specialFolders, TaskConfigExporter taskConfigExporter, Clock clock) {
        this.backups = Objects.requireNonNull(backups, "backups must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.usageReporter = Objects.requireNonNull(usageReporter, "usageReporter must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.liveControls = Objects.requireNonNull(liveControls, "liveControls must not be null");
        this.specialFolders = Objects.requireNonNull(specialFolders, "specialFolders must not be null");
        this.taskConfigExporter = Objects.requireNonNull(taskConfigExporter, "taskConfigExporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Progress of the job currently run from the queue, or of the last one when idle.
     */
    public ProgressSnapshot progress() {
        ProgressTracker active = activeProgress;
        return active != null ? active.snapshot() : lastProgress;
    }

    /**
     * @param fromQueue true when called by the worker; failures are then recorded but not rethrown
     * @return the engine result, or null for aborted and queue-failed runs
     * @throws BackupExecutionException for a failed direct run
     */
    public EngineResult run(JobRequest job, boolean fromQueue) {
        Objects.requireNonNull(job, "job must not be null");
        job.markStarted(clock.instant());

        int pendingCleanups = job.operation() == OperationKind.BACKUP ? job.backup().pendingCleanups() : 0;
        ProgressTracker tracker = new ProgressTracker(job, pendingCleanups);
        if (fromQueue) {
            activeProgress = tracker;
        }

        MDC.put("taskId", Long.toString(job.taskId()));
        if (job.backupId() != null) {
            MDC.put("backupId", job.backupId());
        }
        try {
            log.info("backup4j run starting taskId={} operation={} backupId={}", job.taskId(), job.operation(), job.backupId());
            if (job.operation() == OperationKind.CUSTOM) {
                job.customAction().accept(tracker);
                job.markFinished(JobState.COMPLETED, clock.instant());
                return null;
            }
            return runEngine(job, tracker, fromQueue);
        } finally {
            job.detachController();
            lastProgress = tracker.snapshot();
            if (fromQueue) {
                activeProgress = null;
            }
            MDC.remove("taskId");
            MDC.remove("backupId");
        }
    }

    private EngineResult runEngine(JobRequest job, ProgressTracker tracker, boolean fromQueue) {
        BackupDefinition backup = job.backup();
        Path taskConfigFolder = null;
        Map<String, String> options = null;
        ApplicationSettings settings = ApplicationSettings.defaults();
        EngineOutcome outcome;

        try {
            ApplicationSettings stored = backups.applicationSettings();
            settings = stored == null ? ApplicationSettings.defaults() : stored;
            options = OptionLayers.merge(settings, backup, job.extraOptions());

            if (job.operation() == OperationKind.BACKUP && options.containsKey("store-task-config")) {
                taskConfigFolder = exportTaskConfig(backup, options);
            }
            outcome = execute(job, backup, settings, options, tracker, job.operation());
        } catch (Exception e) {
            outcome = EngineOutcome.failed(e);
        }

        try {
            return switch (outcome.kind()) {
                case OK -> completed(job, backup, settings, options, outcome.result(), tracker, fromQueue);
                case ABORTED_BY_USER, ABORTED_BY_SYSTEM -> aborted(job, backup, outcome);
                case FAILED -> failed(job, backup, outcome.error(), fromQueue);
            };
        } finally {
            taskConfigExporter.deleteQuietly(taskConfigFolder);
        }
    }

    private Path exportTaskConfig(BackupDefinition backup, Map<String, String> options) throws IOException {
        String mode = options.remove("store-task-config");
        List<BackupDefinition> exported;
        if ("all".equalsIgnoreCase(mode) || "*".equals(mode)) {
            exported = backups.listBackups().stream().filter(b -> !b.temporary()).toList();
        } else if (mode == null || mode.isBlank() || OptionLayers.isEnabled(Map.of("v", mode), "v")) {
            exported = List.of(backup);
        } else {
            return null;
        }
        Path folder = taskConfigExporter.export(exported);
        TaskConfigExporter.appendControlFile(options, folder.resolve(TaskConfigExporter.FILE_NAME));
        return folder;
    }

    private EngineOutcome execute(JobRequest job, BackupDefinition backup, ApplicationSettings settings,
                                  Map<String, String> options, ProgressTracker tracker, OperationKind operation) throws Exception {
        if (operation == OperationKind.DELETE && !OptionLayers.isEnabled(options, "delete-remote-files")) {
            return EngineOutcome.ok(null);
        }

        Map<String, String> effective = new LinkedHashMap<>(options);
        if (effective.get("restore-path") != null) {
            effective.put("restore-path", specialFolders.expand(effective.get("restore-path")));
        }

        EngineRequest request = new EngineRequest(
                operation,
                backup.targetUrl(),
                effective,
                backup.sources().stream().map(specialFolders::expand).filter(s -> s != null && !s.isBlank()).toList(),
                filters(settings, backup),
                job.filterStrings(),
                job.extraArguments(),
                job.pageOffset(),
                job.pageSize(),
                tracker
        );

        EngineOperation engineOperation = engine.prepare(request);
        job.attachController(engineOperation, speedOption(effective, "throttle-upload"), speedOption(effective, "throttle-download"));
        job.updateThrottleSpeeds(liveControls.uploadLimit(), liveControls.downloadLimit());
        job.applyThreadPriority(liveControls.threadPriority());

        boolean marker = operation == OperationKind.BACKUP;
        if (marker) {
            backups.markInProgress(backup.id(), IN_PROGRESS_MESSAGE);
        }
        try {
            return invoker.invoke(job, engineOperation);
        } finally {
            job.detachController();
            if (marker) {
                clearInProgress(backup.id());
            }
        }
    }

    private List<FilterRule> filters(ApplicationSettings settings, BackupDefinition backup) {
        List<FilterRule> out = new ArrayList<>();
        for (List<FilterRule> layer : List.of(settings.filters(), backup.filters())) {
            layer.stream()
                    .sorted(Comparator.comparingInt(FilterRule::order))
                    .map(f -> f.withExpression(f.isRegex()
                            ? specialFolders.expandRegex(f.expression())
                            : specialFolders.expand(f.expression())))
                    .forEach(out::add);
        }
        return out;
    }

    private EngineResult completed(JobRequest job, BackupDefinition backup, ApplicationSettings settings,
                                   Map<String, String> options, EngineResult result, ProgressTracker tracker, boolean fromQueue) {
        try {
            OperationKind operation = job.operation();
            if (operation == OperationKind.DELETE) {
                deleteBackup(job, backup, options);
                job.markFinished(JobState.COMPLETED, clock.instant());
                return result;
            }
            if (READ_ONLY.contains(operation)) {
                job.markFinished(JobState.COMPLETED, clock.instant());
                return result;
            }

            Map<String, String> metadata = currentMetadata(backup);
            MetadataWriter.apply(metadata, operation, result);

            if (operation == OperationKind.BACKUP && result != null && !result.interrupted()) {
                runCleanups(job, backup, settings, options, tracker, metadata);
            }

            if (!backup.temporary()) {
                backups.saveMetadata(backup.id(), metadata);
                eventBus.signalNewEvent(EventKind.BACKUP_CHANGED, backup.id());
            }

            if (operation == OperationKind.CREATE_REPORT) {
                String path = result != null && result.reportPath() != null ? result.reportPath() : String.join(" ", job.extraArguments());
                register(new Notification(NotificationSeverity.INFORMATION, "Bugreport ready", "Bugreport is ready for download: " + path,
                        null, backup.id(), "bug-report:created:" + path, null, DedupeRule.NONE, clock.instant()));
            } else {
                notifyResult(backup, result);
            }

            job.markFinished(JobState.COMPLETED, clock.instant());
            log.info("backup4j run completed taskId={} operation={} backupId={} result={}",
                    job.taskId(), operation, backup.id(), result == null ? null : result.parsedResult());
            return result;
        } catch (RuntimeException e) {
            return failed(job, backup, e, fromQueue);
        }
    }

    private void runCleanups(JobRequest job, BackupDefinition backup, ApplicationSettings settings,
                             Map<String, String> options, ProgressTracker tracker, Map<String, String> metadata) {
        List<Map.Entry<OperationKind, Map<String, String>>> cleanups = new ArrayList<>();
        if (backup.keepFull() > 0) {
            Map<String, String> o = new LinkedHashMap<>(options);
            o.put("keep-versions", Integer.toString(backup.keepFull()));
            cleanups.add(Map.entry(OperationKind.DELETE_ALL_BUT_N_FULL, o));
        }
        if (backup.keepTime() != null && !backup.keepTime().isBlank()) {
            Map<String, String> o = new LinkedHashMap<>(options);
            o.put("keep-time", backup.keepTime());
            cleanups.add(Map.entry(OperationKind.DELETE_OLDER_THAN, o));
        }

        for (Map.Entry<OperationKind, Map<String, String>> cleanup : cleanups) {
            if (job.isStopRequested()) {
                return;
            }
            tracker.startExtraOperation("Cleaning up");
            try {
                EngineOutcome outcome = execute(job, backup, settings, cleanup.getValue(), tracker, cleanup.getKey());
                if (outcome.kind() == OutcomeKind.OK) {
                    MetadataWriter.apply(metadata, cleanup.getKey(), outcome.result());
                } else if (outcome.error() != null) {
                    log.warn("backup4j cleanup did not complete taskId={} operation={} backupId={} kind={} msg={}",
                            job.taskId(), cleanup.getKey(), backup.id(), outcome.kind(), outcome.error().getMessage());
                }
            } catch (Exception e) {
                log.warn("backup4j cleanup failed taskId={} operation={} backupId={} msg={}",
                        job.taskId(), cleanup.getKey(), backup.id(), e.getMessage(), e);
                register(new Notification(NotificationSeverity.WARNING, "Cleanup failed for " + backup.name(),
                        e.getMessage(), e.toString(), backup.id(), "backup:show-log", null, DedupeRule.KEEP_EXISTING_ERROR, clock.instant()));
            }
        }
    }

    private void deleteBackup(JobRequest job, BackupDefinition backup, Map<String, String> options) {
        if (OptionLayers.isEnabled(options, "delete-local-db") && backup.dbPath() != null && !backup.dbPath().isBlank()) {
            try {
                Files.deleteIfExists(Path.of(backup.dbPath()));
            } catch (IOException e) {
                throw new BackupExecutionException("Failed to delete local database: " + backup.dbPath(), backup.id(), e);
            }
        }
        backups.deleteBackup(backup.id());
        eventBus.signalNewEvent(EventKind.BACKUP_CHANGED, backup.id());
        if (job.afterFinished() != null) {
            job.afterFinished().accept(job);
        }
        log.info("backup4j backup deleted backupId={} name={}", backup.id(), backup.name());
    }

    private void notifyResult(BackupDefinition backup, EngineResult result) {
        if (result == null || result.interrupted()) {
            return;
        }
        long filesWithError = result.backup() == null ? 0 : result.backup().filesWithError();
        boolean error = result.parsedResult() == ParsedResult.ERROR
                || result.parsedResult() == ParsedResult.FATAL
                || !result.errors().isEmpty()
                || filesWithError > 0;

        if (error) {
            String message = !result.errors().isEmpty()
                    ? result.errors().get(0)
                    : filesWithError > 0
                    ? filesWithError + " file(s) could not be processed"
                    : "The operation completed with errors";
            register(new Notification(NotificationSeverity.ERROR, "Error while running " + backup.name(), message,
                    null, backup.id(), "backup:show-log", null, DedupeRule.REPLACE_SAME_BACKUP, clock.instant()));
        } else if (result.parsedResult() == ParsedResult.WARNING || !result.warnings().isEmpty()) {
            String message = result.warnings().isEmpty()
                    ? "The operation completed with warnings"
                    : result.warnings().get(0);
            register(new Notification(NotificationSeverity.WARNING, "Warning while running " + backup.name(), message,
                    null, backup.id(), "backup:show-log", null, DedupeRule.KEEP_EXISTING_ERROR, clock.instant()));
        }
    }

    /**
     * Metadata as stored now. The job's snapshot is stale when another job ran for the same backup after this one
     * was queued.
     */
    private Map<String, String> currentMetadata(BackupDefinition backup) {
        if (!backup.temporary()) {
            try {
                BackupDefinition stored = backups.findBackup(backup.id());
                if (stored != null) {
                    return new LinkedHashMap<>(stored.metadata());
                }
            } catch (RuntimeException e) {
                log.warn("backup4j failed to reload backup metadata backupId={} msg={}", backup.id(), e.getMessage(), e);
            }
        }
        return new LinkedHashMap<>(backup.metadata());
    }

    private EngineResult aborted(JobRequest job, BackupDefinition backup, EngineOutcome outcome) {
        String reason = outcome.stopReason().message();
        log.info("backup4j run aborted taskId={} operation={} backupId={} reason={}",
                job.taskId(), job.operation(), backup.id(), outcome.stopReason());

        if (!backup.temporary()) {
            Map<String, String> metadata = currentMetadata(backup);
            metadata.put(BackupMetadata.LAST_ABORT_DATE, clock.instant().toString());
            metadata.put(BackupMetadata.LAST_ABORT_REASON, reason);
            if (job.operation() == OperationKind.BACKUP && outcome.stopReason().initiatedBySystem()) {
                metadata.put(BackupMetadata.RESUME_ON_NEXT_LAUNCH, "true");
            }
            try {
                backups.saveMetadata(backup.id(), metadata);
            } catch (RuntimeException e) {
                log.warn("backup4j failed to record abort backupId={} msg={}", backup.id(), e.getMessage(), e);
            }
        }

        register(Notification.info("Stopped " + backup.name(), reason, backup.id(), clock.instant()));
        job.markFinished(JobState.ABORTED, clock.instant());
        return null;
    }

    private EngineResult failed(JobRequest job, BackupDefinition backup, Throwable error, boolean fromQueue) {
        log.error("backup4j run failed taskId={} operation={} backupId={} msg={}",
                job.taskId(), job.operation(), backup.id(), error.getMessage(), error);

        if (!backup.temporary()) {
            Map<String, String> metadata = currentMetadata(backup);
            MetadataWriter.applyError(metadata, error, clock.instant());
            try {
                backups.saveMetadata(backup.id(), metadata);
            } catch (RuntimeException e) {
                log.warn("backup4j failed to record error backupId={} msg={}", backup.id(), e.getMessage(), e);
            }
        }

        String title = backup.temporary() ? "Error" : "Error while running " + backup.name();
        register(new Notification(NotificationSeverity.ERROR, title, error.getMessage(), error.toString(),
                backup.id(), "backup:show-log", null, DedupeRule.REPLACE_SAME_BACKUP, clock.instant()));

        try {
            usageReporter.report(error);
        } catch (RuntimeException e) {
            log.warn("backup4j usage reporter failed msg={}", e.getMessage());
        }

        job.markFinished(JobState.FAILED, clock.instant());

        if (fromQueue) {
            return null;
        }
        if (error instanceof BackupExecutionException bee) {
            throw bee;
        }
        throw new BackupExecutionException("Failed to run " + job.operation() + " for backup " + backup.id(), backup.id(), error);
    }

    private void register(Notification notification) {
        try {
            notifications.register(notification);
            eventBus.signalNewEvent(EventKind.NOTIFICATION, notification.backupId());
        } catch (RuntimeException e) {
            log.warn("backup4j failed to register notification title={} msg={}", notification.title(), e.getMessage(), e);
        }
    }

    private void clearInProgress(String backupId) {
        try {
            backups.clearInProgress(backupId);
        } catch (RuntimeException e) {
            log.warn("backup4j failed to clear in-progress marker backupId={} msg={}", backupId, e.getMessage(), e);
        }
    }

    private static long speedOption(Map<String, String> options, String key) {
        String value = options.get(key);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return SizeParser.parseSize(value, "kb");
        } catch (IllegalArgumentException e) {
            log.warn("backup4j ignoring invalid option {}={}", key, value);
            return 0;
        }
    }
}
