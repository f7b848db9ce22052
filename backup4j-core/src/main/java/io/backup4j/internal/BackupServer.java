package io.backup4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.backup4j.BackupEngine;
import io.backup4j.BackupRepository;
import io.backup4j.BackupService;
import io.backup4j.NotificationSink;
import io.backup4j.PowerSource;
import io.backup4j.ScheduleRepository;
import io.backup4j.UsageReporter;
import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.BackupMetadata;
import io.backup4j.core.DedupeRule;
import io.backup4j.core.EngineResult;
import io.backup4j.core.EventKind;
import io.backup4j.core.JobRequest;
import io.backup4j.core.Notification;
import io.backup4j.core.NotificationSeverity;
import io.backup4j.core.RunState;
import io.backup4j.core.ServerEvent;
import io.backup4j.core.ServerSettings;
import io.backup4j.core.ServerState;
import io.backup4j.core.StopReason;
import io.backup4j.core.ThreadPriority;
import io.backup4j.internal.events.EventBus;
import io.backup4j.internal.live.LiveControlListener;
import io.backup4j.internal.live.LiveControls;
import io.backup4j.internal.live.PowerEventAdapter;
import io.backup4j.internal.queue.WorkQueue;
import io.backup4j.internal.queue.WorkQueueListener;
import io.backup4j.internal.runner.Runner;
import io.backup4j.internal.runner.TaskConfigExporter;
import io.backup4j.internal.schedule.Scheduler;
import io.backup4j.utils.SpecialFolders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns and wires the scheduler, work queue, runner, live controls and event bus.
 */
public class BackupServer implements BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupServer.class);

    private final ServerSettings settings;
    private final BackupRepository backups;
    private final NotificationSink notifications;
    private final Clock clock;

    private final EventBus eventBus;
    private final LiveControls liveControls;
    private final PowerEventAdapter powerEvents;
    private final Runner runner;
    private final WorkQueue workQueue;
    private final Scheduler scheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public BackupServer(ServerSettings settings, ScheduleRepository schedules, BackupRepository backups,
                        BackupEngine engine, NotificationSink notifications) {
        this(settings, schedules, backups, engine, notifications, UsageReporter.noop(), PowerSource.mains(),
                new ObjectMapper().registerModule(new JavaTimeModule()), Clock.systemUTC());
    }

    public BackupServer(ServerSettings settings, ScheduleRepository schedules, BackupRepository backups,
                        BackupEngine engine, NotificationSink notifications, UsageReporter usageReporter,
                        PowerSource powerSource, ObjectMapper objectMapper, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.backups = Objects.requireNonNull(backups, "backups must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(schedules, "schedules must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        this.eventBus = new EventBus(settings.recentEventCapacity(), clock);
        this.liveControls = new LiveControls(clock);
        this.powerEvents = new PowerEventAdapter(liveControls, clock);
        this.runner = new Runner(backups, engine, notifications, usageReporter, eventBus, liveControls,
                SpecialFolders.system(), new TaskConfigExporter(objectMapper), clock);
        this.workQueue = new WorkQueue(job -> runner.run(job, true), false, clock);
        this.scheduler = new Scheduler(schedules, backups, workQueue, powerSource, settings, clock);

        wire();
    }

    private void wire() {
        workQueue.addListener(scheduler);
        workQueue.addListener(new WorkQueueListener() {
            @Override
            public void onWorkStarting(JobRequest job) {
                eventBus.signalNewEvent(EventKind.WORK_STARTED, job.backupId());
            }

            @Override
            public void onWorkCompleted(JobRequest job, Throwable error) {
                eventBus.signalNewEvent(EventKind.WORK_COMPLETED, job.backupId());
            }

            @Override
            public void onQueueChanged() {
                eventBus.signalNewEvent(EventKind.QUEUE_CHANGED, null);
            }

            @Override
            public void onStateChanged(RunState state) {
                eventBus.signalNewEvent(EventKind.STATE_CHANGED, state.name());
            }

            @Override
            public void onError(JobRequest job, Throwable error) {
                eventBus.signalNewEvent(EventKind.WORK_COMPLETED, job.backupId());
            }
        });

        liveControls.addListener(new LiveControlListener() {
            @Override
            public void onStateChanged(RunState state) {
                JobRequest current = workQueue.currentTask();
                if (state == RunState.PAUSED) {
                    workQueue.pause();
                    if (current != null) {
                        current.pause();
                    }
                } else {
                    workQueue.resume();
                    if (current != null) {
                        current.resume();
                    }
                }
                eventBus.signalNewEvent(EventKind.LIVE_CONTROL_CHANGED, state.name());
            }

            @Override
            public void onThreadPriorityChanged(ThreadPriority priority) {
                JobRequest current = workQueue.currentTask();
                if (current != null) {
                    current.applyThreadPriority(priority);
                }
                eventBus.signalNewEvent(EventKind.LIVE_CONTROL_CHANGED, null);
            }

            @Override
            public void onThrottleSpeedChanged(Long uploadLimit, Long downloadLimit) {
                JobRequest current = workQueue.currentTask();
                if (current != null) {
                    current.updateThrottleSpeeds(uploadLimit, downloadLimit);
                }
                eventBus.signalNewEvent(EventKind.LIVE_CONTROL_CHANGED, null);
            }
        });

        scheduler.addListener(plan -> eventBus.signalNewEvent(EventKind.SCHEDULE_CHANGED, null));
    }

    /**
     * Start the worker and scheduler. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ApplicationSettings appSettings = backups.applicationSettings();
            log.info("backup4j starting maxScheduleWait={} idleScheduleWait={} maxSearchIterations={}",
                    settings.maxScheduleWait(), settings.idleScheduleWait(), settings.maxSearchIterations());

            liveControls.configure(appSettings);
            if (liveControls.state() == RunState.PAUSED) {
                workQueue.pause();
            }

            recoverInterruptedBackups();

            workQueue.start();
            scheduler.start();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        log.info("backup4j started");
    }

    /**
     * Stop the scheduler, ask the running job to stop and wait for the worker. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("backup4j stopping...");

        scheduler.terminate(true);

        JobRequest current = workQueue.currentTask();
        if (current != null) {
            current.stop(StopReason.APPLICATION_EXIT);
        }
        workQueue.terminate(false);
        if (!workQueue.awaitTermination(settings.shutdownTimeout())) {
            log.warn("backup4j worker did not stop within timeout={}", settings.shutdownTimeout());
        }
        liveControls.close();
        log.info("backup4j stopped");
    }

    private void recoverInterruptedBackups() {
        List<BackupDefinition> all;
        try {
            all = backups.listBackups();
        } catch (RuntimeException e) {
            log.warn("backup4j failed to read backups on start msg={}", e.getMessage(), e);
            return;
        }

        for (BackupDefinition backup : all) {
            try {
                recoverInterruptedBackup(backup);
            } catch (RuntimeException e) {
                log.warn("backup4j failed to recover backup backupId={} msg={}", backup.id(), e.getMessage(), e);
            }
        }
    }

    private void recoverInterruptedBackup(BackupDefinition backup) {
        Map<String, String> metadata = backup.metadata();
        String inProgress = metadata.get(BackupMetadata.BACKUP_IN_PROGRESS);
        if (inProgress != null) {
            log.warn("backup4j backup was interrupted by a shutdown backupId={}", backup.id());
            notifications.register(new Notification(NotificationSeverity.WARNING,
                    "Backup interrupted: " + backup.name(),
                    "The previous backup was running when the application stopped",
                    inProgress, backup.id(), "backup:show-log", null, DedupeRule.KEEP_EXISTING_ERROR, clock.instant()));
            backups.clearInProgress(backup.id());
        }

        if ("true".equalsIgnoreCase(metadata.get(BackupMetadata.RESUME_ON_NEXT_LAUNCH))) {
            Map<String, String> cleared = new LinkedHashMap<>(metadata);
            cleared.remove(BackupMetadata.RESUME_ON_NEXT_LAUNCH);
            cleared.remove(BackupMetadata.BACKUP_IN_PROGRESS);
            backups.saveMetadata(backup.id(), cleared);
            log.info("backup4j resuming backup stopped by the last shutdown backupId={}", backup.id());
            workQueue.addTask(JobRequest.backup(backup.withMetadata(cleared)));
        }
    }

    @Override
    public void reschedule() {
        scheduler.reschedule();
    }

    @Override
    public JobRequest enqueue(JobRequest job) {
        workQueue.addTask(job);
        return job;
    }

    @Override
    public JobRequest runNow(String backupId) {
        Objects.requireNonNull(backupId, "backupId must not be null");
        BackupDefinition backup = backups.findBackup(backupId);
        if (backup == null) {
            throw new IllegalArgumentException("No such backup: " + backupId);
        }
        return enqueue(JobRequest.backup(backup));
    }

    @Override
    public EngineResult runDirect(JobRequest job) {
        return runner.run(job, false);
    }

    @Override
    public void pause() {
        liveControls.pause();
    }

    @Override
    public void pause(Duration duration) {
        liveControls.pause(duration);
    }

    @Override
    public void resume() {
        liveControls.resume();
    }

    @Override
    public void setThreadPriority(ThreadPriority priority) {
        liveControls.setThreadPriority(priority);
    }

    @Override
    public void setUploadLimit(Long bytesPerSecond) {
        liveControls.setUploadLimit(bytesPerSecond);
    }

    @Override
    public void setDownloadLimit(Long bytesPerSecond) {
        liveControls.setDownloadLimit(bytesPerSecond);
    }

    @Override
    public void stopCurrent(StopReason reason) {
        JobRequest current = workQueue.currentTask();
        if (current != null) {
            current.stop(reason);
        }
    }

    @Override
    public void abortCurrent(StopReason reason) {
        JobRequest current = workQueue.currentTask();
        if (current != null) {
            current.abort(reason);
        }
    }

    @Override
    public void clearQueue(boolean stopCurrent) {
        workQueue.clearQueue(stopCurrent);
    }

    @Override
    public ServerState currentState() {
        JobRequest current = workQueue.currentTask();
        return new ServerState(
                liveControls.state(),
                liveControls.estimatedPauseEnd(),
                current == null ? null : ServerState.TaskInfo.of(current),
                workQueue.pendingTasks().stream().map(ServerState.TaskInfo::of).toList(),
                eventBus.lastEventId(),
                runner.progress(),
                scheduler.proposedSchedule(),
                liveControls.threadPriority(),
                liveControls.uploadLimit(),
                liveControls.downloadLimit()
        );
    }

    @Override
    public long waitForEvent(long lastKnownId, Duration timeout) throws InterruptedException {
        return eventBus.waitForChange(lastKnownId, timeout);
    }

    @Override
    public List<ServerEvent> recentEvents(long sinceId) {
        return eventBus.eventsSince(sinceId);
    }

    /**
     * Hook for platform suspend/resume notifications.
     */
    public PowerEventAdapter powerEvents() {
        return powerEvents;
    }

    WorkQueue workQueue() {
        return workQueue;
    }

    Scheduler scheduler() {
        return scheduler;
    }
}
