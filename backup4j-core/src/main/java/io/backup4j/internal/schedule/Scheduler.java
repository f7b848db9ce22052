package io.backup4j.internal.schedule;

import io.backup4j.BackupRepository;
import io.backup4j.PowerSource;
import io.backup4j.ScheduleRepository;
import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.JobRequest;
import io.backup4j.core.OperationKind;
import io.backup4j.core.ProposedRun;
import io.backup4j.core.ScheduleRecord;
import io.backup4j.core.ScheduledRun;
import io.backup4j.core.ServerSettings;
import io.backup4j.internal.queue.WorkQueue;
import io.backup4j.internal.queue.WorkQueueListener;
import io.backup4j.internal.runner.OptionLayers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns persisted schedules into queued backup jobs.
 * <p>
 * Each pass computes the next run of every active schedule. A due schedule enqueues one backup per
 * target that is not already pending or running, then advances in memory. The new next run time is
 * persisted only after the last job of that trigger reached a terminal state, so a crash in between
 * makes the schedule fire again on restart.
 */
public class Scheduler implements WorkQueueListener {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final String NEXT_SCHEDULED_RUN = "next-scheduled-run";
    static final String DISABLE_ON_BATTERY = "disable-on-battery";

    private static final Duration MIN_STEP = Duration.ofSeconds(1);

    private final ScheduleRepository schedules;
    private final BackupRepository backups;
    private final WorkQueue workQueue;
    private final NextRunCalculator calculator;
    private final PowerSource powerSource;
    private final ServerSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final List<ScheduleListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private List<ScheduledRun> schedule = List.of();
    private final Map<JobRequest, Writeback> writebacks = new IdentityHashMap<>();

    // touched only by the scheduler thread
    private final Map<String, Tracked> tracked = new HashMap<>();

    private volatile boolean terminated;
    private Thread thread;
    private int systemErrorCount;

    private record Fingerprint(String repeat, Set<DayOfWeek> allowedDays, Instant time) {
    }

    private record Tracked(Fingerprint fingerprint, Instant next) {
    }

    private static final class Writeback {
        private final ScheduleRecord schedule;
        private final Instant nextRun;
        private volatile Instant lastRun;

        private Writeback(ScheduleRecord schedule, Instant nextRun, Instant lastRun) {
            this.schedule = schedule;
            this.nextRun = nextRun;
            this.lastRun = lastRun;
        }
    }

    public Scheduler(ScheduleRepository schedules, BackupRepository backups, WorkQueue workQueue,
                     PowerSource powerSource, ServerSettings settings, Clock clock) {
        this.schedules = Objects.requireNonNull(schedules, "schedules must not be null");
        this.backups = Objects.requireNonNull(backups, "backups must not be null");
        this.workQueue = Objects.requireNonNull(workQueue, "workQueue must not be null");
        this.powerSource = Objects.requireNonNull(powerSource, "powerSource must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.calculator = new NextRunCalculator(settings.maxSearchIterations());
    }

    public void addListener(ScheduleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Start the scheduler thread, or a fresh one after {@link #terminate(boolean)}.
     *
     * @throws IllegalStateException if the previous thread has not exited yet
     */
    public void start() {
        Thread t = thread;
        if (t != null && t.isAlive()) {
            if (!terminated) {
                reschedule();
                return;
            }
            throw new IllegalStateException("previous scheduler thread has not exited yet");
        }
        terminated = false;
        started.set(false);
        wakeSignal.drainPermits();
        reschedule();
    }

    /**
     * Wake the scheduler thread, starting it on first use.
     */
    public void reschedule() {
        if (terminated) {
            return;
        }
        if (started.compareAndSet(false, true)) {
            thread = new Thread(this::loop, "backup4j.scheduler");
            thread.setDaemon(true);
            thread.start();
        }
        wakeSignal.release();
    }

    public void terminate(boolean wait) {
        terminated = true;
        wakeSignal.release();
        Thread t = thread;
        if (wait && t != null && t != Thread.currentThread()) {
            try {
                t.join(settings.shutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The published plan, ordered by time.
     */
    public List<ScheduledRun> schedule() {
        synchronized (lock) {
            return schedule;
        }
    }

    public List<ProposedRun> proposedSchedule() {
        List<ProposedRun> out = new ArrayList<>();
        for (ScheduledRun run : schedule()) {
            for (String backupId : run.schedule().directBackupIds()) {
                out.add(new ProposedRun(backupId, run.time()));
            }
        }
        return out;
    }

    private void loop() {
        while (!terminated) {
            Duration wait;
            try {
                wait = runOnce();
                systemErrorCount = 0;
            } catch (RuntimeException e) {
                systemErrorCount++;
                log.error("backup4j scheduler pass failed attempt={} msg={}", systemErrorCount, e.getMessage(), e);
                wait = systemErrorCount >= 10 ? settings.idleScheduleWait() : backoff(systemErrorCount);
            }

            if (terminated) {
                break;
            }

            try {
                wakeSignal.tryAcquire(wait.toMillis(), TimeUnit.MILLISECONDS);
                wakeSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("backup4j scheduler stopped");
    }

    private Duration backoff(int attempt) {
        long ms = Math.min(settings.idleScheduleWait().toMillis(), 500L * (1L << Math.min(attempt, 10)));
        return Duration.ofMillis(ms);
    }

    /**
     * One scheduling pass.
     *
     * @return how long to sleep before the next pass
     */
    Duration runOnce() {
        Instant now = clock.instant();
        ApplicationSettings appSettings = applicationSettings();
        ZoneId zone = appSettings.zone();

        List<ScheduleRecord> records = schedules.listSchedules();
        List<ScheduledRun> plan = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (ScheduleRecord sc : records) {
            if (!sc.isActive()) {
                continue;
            }
            seenIds.add(sc.id());

            Fingerprint fingerprint = new Fingerprint(sc.repeat(), sc.allowedDays(), sc.time());
            Tracked previous = tracked.get(sc.id());

            Instant start;
            Instant last = Instant.EPOCH;
            if (previous == null || !previous.fingerprint().equals(fingerprint)) {
                start = sc.time();
                last = sc.lastRun() == null ? Instant.EPOCH : sc.lastRun();
            } else {
                start = previous.next();
            }

            // clock moved backwards since the last run
            if (last.isAfter(now)) {
                log.warn("backup4j schedule lastRun in the future, resetting scheduleId={} lastRun={} now={}", sc.id(), last, now);
                start = now;
                last = now;
            }

            try {
                start = calculator.nextValidTime(sc.id(), start, last, sc.repeat(), sc.allowedDays(), zone);
            } catch (RuntimeException e) {
                log.warn("backup4j schedule skipped scheduleId={} msg={}", sc.id(), e.getMessage());
                tracked.remove(sc.id());
                continue;
            }

            if (!start.isAfter(now)) {
                Instant lowerBound = later(now.plus(MIN_STEP), start.plus(MIN_STEP));
                Instant next;
                try {
                    next = calculator.nextValidTime(sc.id(), start, lowerBound, sc.repeat(), sc.allowedDays(), zone);
                } catch (RuntimeException e) {
                    log.warn("backup4j schedule skipped scheduleId={} msg={}", sc.id(), e.getMessage());
                    tracked.remove(sc.id());
                    continue;
                }

                List<JobRequest> jobs = collectJobs(sc, appSettings, next);
                if (!jobs.isEmpty()) {
                    JobRequest lastJob = jobs.get(jobs.size() - 1);
                    synchronized (lock) {
                        writebacks.put(lastJob, new Writeback(sc, next, now));
                    }
                    for (JobRequest job : jobs) {
                        workQueue.addTask(job);
                    }
                    log.info("backup4j schedule fired scheduleId={} jobs={} next={}", sc.id(), jobs.size(), next);
                }
                start = next;
            }

            if (start.isBefore(now)) {
                log.warn("backup4j schedule next run in the past, skipping scheduleId={} next={}", sc.id(), start);
                continue;
            }

            tracked.put(sc.id(), new Tracked(fingerprint, start));
            plan.add(new ScheduledRun(start, sc));
        }

        tracked.keySet().retainAll(seenIds);
        plan.sort(Comparator.comparing(ScheduledRun::time));
        publish(plan);

        return nextWait(plan, now);
    }

    private List<JobRequest> collectJobs(ScheduleRecord sc, ApplicationSettings appSettings, Instant next) {
        Set<String> busy = new HashSet<>();
        for (JobRequest job : workQueue.currentTasks()) {
            if (job.operation() == OperationKind.BACKUP && job.backupId() != null) {
                busy.add(job.backupId());
            }
        }

        List<JobRequest> jobs = new ArrayList<>();
        for (String backupId : new LinkedHashSet<>(schedules.findBackupIdsByTags(sc.tags()))) {
            if (busy.contains(backupId)) {
                log.debug("backup4j schedule target already queued scheduleId={} backupId={}", sc.id(), backupId);
                continue;
            }
            BackupDefinition backup = backups.findBackup(backupId);
            if (backup == null) {
                log.warn("backup4j schedule target not found scheduleId={} backupId={}", sc.id(), backupId);
                continue;
            }

            Map<String, String> options = OptionLayers.merge(appSettings, backup, Map.of());
            if (OptionLayers.isEnabled(options, DISABLE_ON_BATTERY) && onBattery()) {
                log.info("backup4j skipping scheduled backup on battery power scheduleId={} backupId={}", sc.id(), backupId);
                continue;
            }

            jobs.add(JobRequest.builder(OperationKind.BACKUP, backup)
                    .extraOption(NEXT_SCHEDULED_RUN, next.toString())
                    .build());
            busy.add(backupId);
        }
        return jobs;
    }

    private boolean onBattery() {
        try {
            return powerSource.onBattery();
        } catch (RuntimeException e) {
            log.warn("backup4j power source failed msg={}", e.getMessage());
            return false;
        }
    }

    private Duration nextWait(List<ScheduledRun> plan, Instant now) {
        Duration wait;
        if (plan.isEmpty()) {
            wait = settings.idleScheduleWait();
        } else {
            wait = Duration.between(now, plan.get(0).time());
            if (wait.compareTo(settings.maxScheduleWait()) > 0) {
                wait = settings.maxScheduleWait();
            }
        }
        if (wait.compareTo(settings.minScheduleWait()) < 0) {
            wait = settings.minScheduleWait();
        }
        return wait;
    }

    private void publish(List<ScheduledRun> plan) {
        List<ScheduledRun> snapshot = List.copyOf(plan);
        boolean changed;
        synchronized (lock) {
            changed = !snapshot.equals(schedule);
            schedule = snapshot;
        }
        if (!changed) {
            return;
        }
        for (ScheduleListener l : listeners) {
            try {
                l.onScheduleChanged(snapshot);
            } catch (RuntimeException e) {
                log.warn("backup4j schedule listener failed msg={}", e.getMessage(), e);
            }
        }
    }

    private ApplicationSettings applicationSettings() {
        ApplicationSettings s = backups.applicationSettings();
        return s == null ? ApplicationSettings.defaults() : s;
    }

    @Override
    public void onWorkStarting(JobRequest job) {
        Writeback wb;
        synchronized (lock) {
            wb = writebacks.get(job);
        }
        if (wb != null) {
            wb.lastRun = clock.instant();
        }
    }

    @Override
    public void onWorkCompleted(JobRequest job, Throwable error) {
        Writeback wb;
        synchronized (lock) {
            wb = writebacks.remove(job);
        }
        if (wb == null) {
            return;
        }
        try {
            schedules.saveNextRun(wb.schedule.id(), wb.nextRun, wb.lastRun);
            log.debug("backup4j schedule updated scheduleId={} next={} lastRun={}", wb.schedule.id(), wb.nextRun, wb.lastRun);
        } catch (RuntimeException e) {
            log.error("backup4j failed to save schedule scheduleId={} msg={}", wb.schedule.id(), e.getMessage(), e);
        }
        if (started.get()) {
            wakeSignal.release();
        }
    }

    @Override
    public void onTaskRemoved(JobRequest job) {
        Writeback wb;
        synchronized (lock) {
            wb = writebacks.remove(job);
        }
        if (wb != null) {
            log.debug("backup4j scheduled job dropped from queue scheduleId={} taskId={}", wb.schedule.id(), job.taskId());
        }
    }

    int pendingWritebacks() {
        synchronized (lock) {
            return writebacks.size();
        }
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
