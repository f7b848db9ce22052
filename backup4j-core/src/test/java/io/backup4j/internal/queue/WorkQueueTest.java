package io.backup4j.internal.queue;

import io.backup4j.core.BackupDefinition;
import io.backup4j.core.JobRequest;
import io.backup4j.core.JobState;
import io.backup4j.core.RunState;
import io.backup4j.core.StopReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkQueueTest {

    private final List<String> executed = new CopyOnWriteArrayList<>();
    private WorkQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.terminate(true);
        }
    }

    private static JobRequest backup(String id) {
        return JobRequest.backup(BackupDefinition.of(id, id, "file:///tmp/" + id));
    }

    @Test
    void jobsShouldRunInSubmissionOrder() throws Exception {
        CountDownLatch done = new CountDownLatch(3);
        queue = new WorkQueue(job -> {
            executed.add(job.backupId());
            done.countDown();
        }, false, Clock.systemUTC());
        queue.start();

        queue.addTask(backup("a"));
        queue.addTask(backup("b"));
        queue.addTask(backup("c"));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), executed);
    }

    @Test
    void failingJobShouldNotStopWorker() throws Exception {
        CountDownLatch completed = new CountDownLatch(2);
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        queue = new WorkQueue(job -> {
            if ("bad".equals(job.backupId())) {
                throw new IllegalStateException("engine exploded");
            }
            executed.add(job.backupId());
        }, false, Clock.systemUTC());
        queue.addListener(new WorkQueueListener() {
            @Override
            public void onError(JobRequest job, Throwable error) {
                errors.add(error);
            }

            @Override
            public void onWorkCompleted(JobRequest job, Throwable error) {
                completed.countDown();
            }
        });
        queue.start();

        JobRequest bad = backup("bad");
        JobRequest good = backup("good");
        queue.addTask(bad);
        queue.addTask(good);

        assertTrue(completed.await(5, TimeUnit.SECONDS));
        assertEquals(1, errors.size());
        assertEquals("engine exploded", errors.get(0).getMessage());
        assertEquals(JobState.FAILED, bad.state());
        assertEquals(JobState.COMPLETED, good.state());
        assertEquals(List.of("good"), executed);
        assertTrue(queue.isActive());
    }

    @Test
    void jobThrowingErrorShouldNotStopWorker() throws Exception {
        CountDownLatch completed = new CountDownLatch(2);
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        queue = new WorkQueue(job -> {
            if ("bad".equals(job.backupId())) {
                throw new AssertionError("native crash");
            }
            executed.add(job.backupId());
        }, false, Clock.systemUTC());
        queue.addListener(new WorkQueueListener() {
            @Override
            public void onError(JobRequest job, Throwable error) {
                errors.add(error);
            }

            @Override
            public void onWorkCompleted(JobRequest job, Throwable error) {
                completed.countDown();
            }
        });
        queue.start();

        JobRequest bad = backup("bad");
        queue.addTask(bad);
        queue.addTask(backup("good"));

        assertTrue(completed.await(5, TimeUnit.SECONDS));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0) instanceof AssertionError);
        assertEquals(JobState.FAILED, bad.state());
        assertEquals(List.of("good"), executed);
        assertTrue(queue.isActive());
    }

    @Test
    void queueChangesShouldNotifyListeners() {
        AtomicInteger changes = new AtomicInteger();
        List<JobRequest> removed = new CopyOnWriteArrayList<>();
        queue = new WorkQueue(job -> {
        }, false, Clock.systemUTC());
        queue.addListener(new WorkQueueListener() {
            @Override
            public void onQueueChanged() {
                changes.incrementAndGet();
            }

            @Override
            public void onTaskRemoved(JobRequest job) {
                removed.add(job);
            }
        });

        JobRequest a = backup("a");
        JobRequest b = backup("b");
        JobRequest c = backup("c");
        queue.addTask(a);
        queue.addTask(b);
        queue.addTask(c);
        assertEquals(3, changes.get());

        queue.removeTask(a);
        assertEquals(4, changes.get());
        assertEquals(List.of(a), removed);

        queue.clearQueue(false);
        assertEquals(5, changes.get());
        assertEquals(List.of(a, b, c), removed);
    }

    @Test
    void clearQueueShouldStopRunningJobWhenAsked() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue = new WorkQueue(job -> {
            running.countDown();
            release.await(5, TimeUnit.SECONDS);
        }, false, Clock.systemUTC());
        queue.start();

        JobRequest first = backup("a");
        JobRequest second = backup("b");
        queue.addTask(first);
        assertTrue(running.await(5, TimeUnit.SECONDS));
        queue.addTask(second);

        queue.clearQueue(true);

        assertTrue(first.isStopRequested());
        assertEquals(StopReason.USER_CLOSING, first.stopReason());
        assertFalse(second.isStopRequested());
        assertTrue(queue.pendingTasks().isEmpty());
        release.countDown();
    }

    @Test
    void terminatedQueueShouldStartAgain() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        queue = new WorkQueue(job -> {
            executed.add(job.backupId());
            done.countDown();
        }, false, Clock.systemUTC());
        queue.start();
        queue.terminate(true);
        assertFalse(queue.isActive());

        queue.start();
        queue.addTask(backup("again"));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("again"), executed);
        assertTrue(queue.isActive());
    }

    @Test
    void pausedQueueShouldHoldJobsUntilResumed() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        queue = new WorkQueue(job -> done.countDown(), true, Clock.systemUTC());
        queue.start();

        JobRequest job = backup("a");
        queue.addTask(job);

        assertFalse(done.await(200, TimeUnit.MILLISECONDS));
        assertEquals(RunState.PAUSED, queue.state());
        assertEquals(List.of(job), queue.pendingTasks());

        queue.resume();
        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void skipQueueShouldPutJobFirst() {
        queue = new WorkQueue(job -> {
        }, false, Clock.systemUTC());

        JobRequest a = backup("a");
        JobRequest b = backup("b");
        queue.addTask(a);
        queue.addTask(b, true);

        assertEquals(List.of(b, a), queue.pendingTasks());
        assertEquals(JobState.QUEUED, a.state());
    }

    @Test
    void currentTasksShouldIncludeRunningJob() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue = new WorkQueue(job -> {
            running.countDown();
            release.await(5, TimeUnit.SECONDS);
        }, false, Clock.systemUTC());
        queue.start();

        JobRequest first = backup("a");
        JobRequest second = backup("b");
        queue.addTask(first);
        assertTrue(running.await(5, TimeUnit.SECONDS));
        queue.addTask(second);

        assertSame(first, queue.currentTask());
        assertEquals(List.of(first, second), queue.currentTasks());

        queue.clearQueue(false);
        assertEquals(List.of(first), queue.currentTasks());

        release.countDown();
    }

    @Test
    void removeTaskShouldDropPendingJob() {
        queue = new WorkQueue(job -> {
        }, false, Clock.systemUTC());
        JobRequest a = backup("a");
        queue.addTask(a);

        assertTrue(queue.removeTask(a));
        assertFalse(queue.removeTask(a));
        assertTrue(queue.pendingTasks().isEmpty());
        assertNull(queue.currentTask());
    }

    @Test
    void terminateShouldStopWorker() {
        queue = new WorkQueue(job -> {
        }, false, Clock.systemUTC());
        queue.start();

        queue.terminate(true);

        assertFalse(queue.isActive());
    }
}
