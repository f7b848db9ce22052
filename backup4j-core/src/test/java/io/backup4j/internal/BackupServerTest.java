package io.backup4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.NotificationSink;
import io.backup4j.PowerSource;
import io.backup4j.UsageReporter;
import io.backup4j.core.BackupDefinition;
import io.backup4j.core.BackupMetadata;
import io.backup4j.core.EventKind;
import io.backup4j.core.JobRequest;
import io.backup4j.core.JobState;
import io.backup4j.core.NotificationSeverity;
import io.backup4j.core.RunState;
import io.backup4j.core.ServerEvent;
import io.backup4j.core.ServerSettings;
import io.backup4j.core.ServerState;
import io.backup4j.core.StopReason;
import io.backup4j.testing.FakeEngine;
import io.backup4j.testing.InMemoryBackupRepository;
import io.backup4j.testing.InMemoryScheduleRepository;
import io.backup4j.testing.RecordingNotificationSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupServerTest {

    private final InMemoryScheduleRepository schedules = new InMemoryScheduleRepository();
    private final InMemoryBackupRepository backups = new InMemoryBackupRepository();
    private final RecordingNotificationSink notifications = new RecordingNotificationSink();
    private final FakeEngine engine = new FakeEngine();

    private BackupServer server;

    @BeforeEach
    void setUp() {
        backups.put(BackupDefinition.of("b1", "Documents", "file:///backup/docs"));
        server = new BackupServer(ServerSettings.defaults(), schedules, backups, engine, notifications,
                UsageReporter.noop(), PowerSource.mains(), new ObjectMapper(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void runNowShouldExecuteBackupAndPublishEvents() throws Exception {
        server.start();

        JobRequest job = server.runNow("b1");
        await(() -> job.state() == JobState.COMPLETED);

        assertThat(engine.requests).hasSize(1);
        assertThat(server.recentEvents(0)).extracting(ServerEvent::kind)
                .contains(EventKind.QUEUE_CHANGED, EventKind.WORK_STARTED, EventKind.WORK_COMPLETED);
        assertThat(backups.findBackup("b1").metadata()).containsKey(BackupMetadata.LAST_BACKUP_FINISHED);
    }

    @Test
    void runNowShouldRejectUnknownBackup() {
        server.start();

        assertThatThrownBy(() -> server.runNow("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pausedServerShouldHoldJobsUntilResumed() throws Exception {
        server.start();
        server.pause();

        JobRequest job = server.runNow("b1");
        Thread.sleep(200);

        ServerState state = server.currentState();
        assertThat(state.programState()).isEqualTo(RunState.PAUSED);
        assertThat(state.pendingTasks()).extracting(ServerState.TaskInfo::backupId).containsExactly("b1");
        assertThat(engine.requests).isEmpty();

        server.resume();
        await(() -> job.state() == JobState.COMPLETED);
        assertThat(server.currentState().programState()).isEqualTo(RunState.RUNNING);
    }

    @Test
    void waitForEventShouldReturnAfterStateChange() throws Exception {
        server.start();
        long seen = server.currentState().lastEventId();

        Thread pauser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            server.pause(Duration.ofMinutes(5));
        });
        pauser.start();

        long next = server.waitForEvent(seen, Duration.ofSeconds(5));
        pauser.join();

        assertThat(next).isGreaterThan(seen);
        assertThat(server.currentState().estimatedPauseEnd()).isNotNull();
    }

    @Test
    void startShouldRecoverInterruptedBackup() throws Exception {
        backups.put(BackupDefinition.of("b1", "Documents", "file:///backup/docs").withMetadata(Map.of(
                BackupMetadata.BACKUP_IN_PROGRESS, "shutdown while backup in progress",
                BackupMetadata.RESUME_ON_NEXT_LAUNCH, "true")));

        server.start();
        await(() -> engine.requests.size() == 1);

        assertThat(notifications.withSeverity(NotificationSeverity.WARNING)).hasSize(1);
        assertThat(backups.clearedInProgress).contains("b1");
        await(() -> !backups.findBackup("b1").metadata().containsKey(BackupMetadata.BACKUP_IN_PROGRESS));
        assertThat(backups.findBackup("b1").metadata()).doesNotContainKey(BackupMetadata.RESUME_ON_NEXT_LAUNCH);
    }

    @Test
    void stopShouldAbortRunningBackupAndMarkForResume() throws Exception {
        engine.blockUntilStopped();
        server.start();

        JobRequest job = server.runNow("b1");
        await(() -> !engine.operations.isEmpty());
        assertTrue(engine.operations.get(0).started.await(5, TimeUnit.SECONDS));

        server.stop();

        assertThat(job.state()).isEqualTo(JobState.ABORTED);
        assertThat(backups.findBackup("b1").metadata())
                .containsEntry(BackupMetadata.RESUME_ON_NEXT_LAUNCH, "true")
                .doesNotContainKey(BackupMetadata.BACKUP_IN_PROGRESS);
    }

    @Test
    void liveThrottleShouldReachRunningOperation() throws Exception {
        engine.blockUntilStopped();
        server.start();

        server.runNow("b1");
        await(() -> !engine.operations.isEmpty());
        FakeEngine.FakeOperation op = engine.operations.get(0);
        assertTrue(op.started.await(5, TimeUnit.SECONDS));

        server.setUploadLimit(4096L);

        assertThat(op.uploadLimit).isEqualTo(4096);
        assertThat(server.currentState().uploadLimit()).isEqualTo(4096L);
    }

    @Test
    void stopCurrentShouldStopRunningOperation() throws Exception {
        engine.blockUntilStopped();
        server.start();

        JobRequest job = server.runNow("b1");
        await(() -> !engine.operations.isEmpty());
        FakeEngine.FakeOperation op = engine.operations.get(0);
        assertTrue(op.started.await(5, TimeUnit.SECONDS));

        server.stopCurrent(StopReason.USER_CLOSING);

        await(() -> job.state() == JobState.ABORTED);
        assertThat(op.stopCalls).isEqualTo(1);
        assertThat(op.abortCalls).isZero();
        assertThat(backups.findBackup("b1").metadata()).doesNotContainKey(BackupMetadata.RESUME_ON_NEXT_LAUNCH);
    }

    @Test
    void abortCurrentShouldAbortRunningOperation() throws Exception {
        engine.blockUntilStopped();
        server.start();

        JobRequest job = server.runNow("b1");
        await(() -> !engine.operations.isEmpty());
        FakeEngine.FakeOperation op = engine.operations.get(0);
        assertTrue(op.started.await(5, TimeUnit.SECONDS));

        server.abortCurrent(StopReason.USER_CLOSING);

        await(() -> job.state() == JobState.ABORTED);
        assertThat(op.abortCalls).isEqualTo(1);
        assertThat(op.stopCalls).isZero();
        assertThat(job.stopReason()).isEqualTo(StopReason.USER_CLOSING);
    }

    @Test
    void restartedServerShouldRunJobs() throws Exception {
        server.start();
        server.stop();
        server.start();

        JobRequest job = server.runNow("b1");
        await(() -> job.state() == JobState.COMPLETED);

        assertThat(engine.requests).hasSize(1);
        server.pause(Duration.ofMinutes(1));
        assertThat(server.currentState().estimatedPauseEnd()).isNotNull();
    }

    @Test
    void failedRecoveryShouldNotBlockStartOrOtherBackups() throws Exception {
        NotificationSink failing = notification -> {
            if ("b0".equals(notification.backupId())) {
                throw new IllegalStateException("notification store unavailable");
            }
            notifications.register(notification);
        };
        backups.put(BackupDefinition.of("b0", "Broken", "file:///backup/broken").withMetadata(Map.of(
                BackupMetadata.BACKUP_IN_PROGRESS, "shutdown while backup in progress")));
        backups.put(BackupDefinition.of("b1", "Documents", "file:///backup/docs").withMetadata(Map.of(
                BackupMetadata.RESUME_ON_NEXT_LAUNCH, "true")));
        server = new BackupServer(ServerSettings.defaults(), schedules, backups, engine, failing,
                UsageReporter.noop(), PowerSource.mains(), new ObjectMapper(), Clock.systemUTC());

        server.start();

        await(() -> engine.requests.size() == 1);
        assertThat(engine.requests.get(0).targetUrl()).isEqualTo("file:///backup/docs");
        JobRequest job = server.runNow("b1");
        await(() -> job.state() == JobState.COMPLETED);
    }
}
