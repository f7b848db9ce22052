package io.backup4j.internal.schedule;

import io.backup4j.core.BackupDefinition;
import io.backup4j.core.JobRequest;
import io.backup4j.core.OperationKind;
import io.backup4j.core.ScheduleRecord;
import io.backup4j.core.ScheduledRun;
import io.backup4j.core.ServerSettings;
import io.backup4j.core.SettingEntry;
import io.backup4j.internal.queue.WorkQueue;
import io.backup4j.testing.InMemoryBackupRepository;
import io.backup4j.testing.InMemoryScheduleRepository;
import io.backup4j.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives single scheduler passes against a work queue whose worker is never started,
 * so enqueued jobs stay pending until the test completes them.
 */
class SchedulerTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private MutableClock clock;
    private InMemoryScheduleRepository schedules;
    private InMemoryBackupRepository backups;
    private WorkQueue queue;
    private AtomicBoolean onBattery;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plusSeconds(30));
        schedules = new InMemoryScheduleRepository();
        backups = new InMemoryBackupRepository();
        queue = new WorkQueue(job -> {
        }, false, clock);
        onBattery = new AtomicBoolean(false);
        scheduler = new Scheduler(schedules, backups, queue, onBattery::get, ServerSettings.defaults(), clock);

        backups.put(BackupDefinition.of("b1", "Documents", "file:///backup/docs"));
        backups.put(BackupDefinition.of("b2", "Photos", "file:///backup/photos"));
    }

    private static ScheduleRecord daily(String id, String... tags) {
        return new ScheduleRecord(id, List.of(tags), "1D", Set.of(), T0, null);
    }

    @Test
    void dueScheduleShouldEnqueueOneJobAndPersistOnlyAfterCompletion() {
        schedules.put(daily("s1", "ID=b1"));

        scheduler.runOnce();

        List<JobRequest> pending = queue.pendingTasks();
        assertThat(pending).hasSize(1);
        JobRequest job = pending.get(0);
        assertThat(job.operation()).isEqualTo(OperationKind.BACKUP);
        assertThat(job.backupId()).isEqualTo("b1");
        assertThat(job.extraOptions()).containsEntry(Scheduler.NEXT_SCHEDULED_RUN, T0.plus(Duration.ofDays(1)).toString());
        assertThat(schedules.saved).isEmpty();

        // a second pass before completion must not dispatch again
        scheduler.runOnce();
        assertThat(queue.pendingTasks()).hasSize(1);
        assertThat(schedules.saved).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        scheduler.onWorkStarting(job);
        clock.advance(Duration.ofMinutes(5));
        scheduler.onWorkCompleted(job, null);

        assertThat(schedules.saved).hasSize(1);
        ScheduleRecord saved = schedules.get("s1");
        assertThat(saved.time()).isEqualTo(T0.plus(Duration.ofDays(1)));
        assertThat(saved.lastRun()).isEqualTo(T0.plusSeconds(90));
        assertThat(saved.time()).isAfter(T0.plusSeconds(30));
    }

    @Test
    void persistedRunShouldNotFireAgainUntilNextTime() {
        schedules.put(daily("s1", "ID=b1"));
        scheduler.runOnce();
        JobRequest job = queue.pendingTasks().get(0);
        queue.removeTask(job);
        scheduler.onWorkStarting(job);
        scheduler.onWorkCompleted(job, null);

        scheduler.runOnce();
        assertThat(queue.pendingTasks()).isEmpty();
        assertThat(scheduler.schedule()).extracting(ScheduledRun::time).containsExactly(T0.plus(Duration.ofDays(1)));

        clock.set(T0.plus(Duration.ofDays(1)).plusSeconds(1));
        scheduler.runOnce();
        assertThat(queue.pendingTasks()).hasSize(1);
    }

    @Test
    void schedulesSharingTargetShouldDispatchOnce() {
        schedules.put(daily("s1", "ID=b1"));
        schedules.put(daily("s2", "nightly"));
        schedules.tag("nightly", "b1");

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).extracting(JobRequest::backupId).containsExactly("b1");
        assertThat(scheduler.schedule()).hasSize(2);
    }

    @Test
    void runningJobShouldSuppressDuplicate() {
        schedules.put(daily("s1", "ID=b1"));
        scheduler.runOnce();
        assertThat(queue.pendingTasks()).hasSize(1);

        // the schedule changed while the job is still pending
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "12h", Set.of(), T0, null));
        scheduler.runOnce();

        assertThat(queue.pendingTasks()).hasSize(1);
    }

    @Test
    void tagShouldFanOutToEveryTarget() {
        schedules.put(daily("s1", "nightly"));
        schedules.tag("nightly", "b1", "b2", "b1");

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).extracting(JobRequest::backupId).containsExactly("b1", "b2");
    }

    @Test
    void writebackShouldWaitForLastJobOfTrigger() {
        schedules.put(daily("s1", "nightly"));
        schedules.tag("nightly", "b1", "b2");
        scheduler.runOnce();
        List<JobRequest> jobs = queue.pendingTasks();

        scheduler.onWorkCompleted(jobs.get(0), null);
        assertThat(schedules.saved).isEmpty();

        scheduler.onWorkCompleted(jobs.get(1), new IllegalStateException("boom"));
        assertThat(schedules.saved).hasSize(1);
    }

    @Test
    void clearedJobShouldDropItsWriteback() {
        queue.addListener(scheduler);
        schedules.put(daily("s1", "ID=b1"));
        scheduler.runOnce();
        assertThat(scheduler.pendingWritebacks()).isEqualTo(1);

        queue.clearQueue(false);

        assertThat(scheduler.pendingWritebacks()).isZero();
        assertThat(schedules.saved).isEmpty();
    }

    @Test
    void futureScheduleShouldNotFire() {
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "1D", Set.of(), T0.plus(Duration.ofHours(2)), null));

        Duration wait = scheduler.runOnce();

        assertThat(queue.pendingTasks()).isEmpty();
        assertThat(wait).isEqualTo(ServerSettings.defaults().maxScheduleWait());
    }

    @Test
    void waitShouldBeTimeUntilNextRunWhenSoon() {
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "1D", Set.of(), T0.plus(Duration.ofMinutes(2)), null));

        assertThat(scheduler.runOnce()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void emptyScheduleShouldWaitIdlePeriod() {
        assertThat(scheduler.runOnce()).isEqualTo(ServerSettings.defaults().idleScheduleWait());
        assertThat(scheduler.schedule()).isEmpty();
    }

    @Test
    void blankRepeatShouldBeIgnored() {
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), " ", Set.of(), T0, null));

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).isEmpty();
        assertThat(scheduler.schedule()).isEmpty();
    }

    @Test
    void brokenScheduleShouldNotBlockOthers() {
        schedules.put(new ScheduleRecord("bad", List.of("ID=b2"), "every now and then", Set.of(), T0, null));
        schedules.put(daily("good", "ID=b1"));

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).extracting(JobRequest::backupId).containsExactly("b1");
        assertThat(scheduler.schedule()).extracting(r -> r.schedule().id()).containsExactly("good");
    }

    @Test
    void allowedDaysShouldDelayRun() {
        // T0 is a Monday
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "1D", EnumSet.of(DayOfWeek.WEDNESDAY), T0, null));

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).isEmpty();
        assertThat(scheduler.schedule()).extracting(ScheduledRun::time).containsExactly(Instant.parse("2026-01-07T09:00:00Z"));
    }

    @Test
    void lastRunInFutureShouldReseedFromNow() {
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "1D", Set.of(), T0, T0.plus(Duration.ofDays(30))));

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).hasSize(1);
        assertThat(scheduler.schedule().get(0).time()).isAfter(clock.instant());
    }

    @Test
    void disableOnBatteryShouldSkipScheduledBackup() {
        backups.put(BackupDefinition.of("b1", "Documents", "file:///backup/docs")
                .withSettings(List.of(new SettingEntry("disable-on-battery", "true"))));
        schedules.put(daily("s1", "ID=b1"));
        onBattery.set(true);

        scheduler.runOnce();

        assertThat(queue.pendingTasks()).isEmpty();
        assertThat(schedules.saved).isEmpty();
    }

    @Test
    void removedScheduleShouldDisappearFromPlan() {
        schedules.put(new ScheduleRecord("s1", List.of("ID=b1"), "1D", Set.of(), T0.plus(Duration.ofHours(1)), null));
        scheduler.runOnce();
        assertThat(scheduler.proposedSchedule()).hasSize(1);
        assertThat(scheduler.proposedSchedule().get(0).backupId()).isEqualTo("b1");

        schedules.remove("s1");
        scheduler.runOnce();

        assertThat(scheduler.schedule()).isEmpty();
    }
}
