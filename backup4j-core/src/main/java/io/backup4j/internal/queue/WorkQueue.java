package io.backup4j.internal.queue;

import io.backup4j.core.JobRequest;
import io.backup4j.core.JobState;
import io.backup4j.core.RunState;
import io.backup4j.core.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of jobs processed by a single worker thread, so no two jobs ever run at once.
 * <p>
 * A job that throws, including an {@link Error}, is reported through {@link WorkQueueListener#onError}
 * and marked failed; the worker keeps going. A dequeued job stays visible through {@link #currentTask()} until it finished.
 */
public class WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);
    private static final long IDLE_WAIT_MINUTES = 5;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private final Deque<JobRequest> tasks = new ArrayDeque<>();
    private final List<WorkQueueListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final JobExecutor executor;
    private final Clock clock;
    private volatile Thread worker;

    private volatile RunState state;
    private volatile boolean terminated;
    private JobRequest currentTask;

    public WorkQueue(JobExecutor executor, boolean paused, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.state = paused ? RunState.PAUSED : RunState.RUNNING;
    }

    public void addListener(WorkQueueListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Start the worker. After {@link #terminate(boolean)} this starts a fresh worker on the pending jobs.
     *
     * @throws IllegalStateException if the previous worker is still finishing its job
     */
    public void start() {
        lock.lock();
        try {
            Thread current = worker;
            if (current != null && current.isAlive()) {
                if (!terminated) {
                    return;
                }
                throw new IllegalStateException("previous worker has not exited yet");
            }
            terminated = false;
            Thread t = new Thread(this::runLoop, "backup4j.worker");
            t.setDaemon(true);
            worker = t;
            started.set(true);
            t.start();
        } finally {
            lock.unlock();
        }
    }

    public void addTask(JobRequest job) {
        addTask(job, false);
    }

    /**
     * @param skipQueue put the job ahead of every pending job
     */
    public void addTask(JobRequest job, boolean skipQueue) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            if (terminated) {
                throw new IllegalStateException("work queue is terminated");
            }
            job.markQueued();
            if (skipQueue) {
                tasks.addFirst(job);
            } else {
                tasks.addLast(job);
            }
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        fireQueueChanged();
    }

    public boolean removeTask(JobRequest job) {
        boolean removed;
        lock.lock();
        try {
            removed = tasks.remove(job);
        } finally {
            lock.unlock();
        }
        if (removed) {
            fireTasksRemoved(List.of(job));
            fireQueueChanged();
        }
        return removed;
    }

    /**
     * Drop every pending job and optionally ask the running one to stop.
     */
    public void clearQueue(boolean stopCurrent) {
        JobRequest running;
        List<JobRequest> dropped;
        lock.lock();
        try {
            dropped = List.copyOf(tasks);
            tasks.clear();
            running = currentTask;
        } finally {
            lock.unlock();
        }
        if (stopCurrent && running != null) {
            running.stop(StopReason.USER_CLOSING);
        }
        fireTasksRemoved(dropped);
        fireQueueChanged();
    }

    public void pause() {
        setState(RunState.PAUSED);
    }

    public void resume() {
        setState(RunState.RUNNING);
    }

    public RunState state() {
        return state;
    }

    public boolean isActive() {
        Thread t = worker;
        return t != null && !terminated && t.isAlive();
    }

    public JobRequest currentTask() {
        lock.lock();
        try {
            return currentTask;
        } finally {
            lock.unlock();
        }
    }

    public List<JobRequest> pendingTasks() {
        lock.lock();
        try {
            return List.copyOf(tasks);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The running job, if any, followed by the pending jobs.
     */
    public List<JobRequest> currentTasks() {
        lock.lock();
        try {
            List<JobRequest> out = new ArrayList<>(tasks.size() + 1);
            if (currentTask != null) {
                out.add(currentTask);
            }
            out.addAll(tasks);
            return out;
        } finally {
            lock.unlock();
        }
    }

    public void terminate(boolean wait) {
        lock.lock();
        try {
            terminated = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        if (wait && started.get()) {
            awaitTermination(null);
        }
    }

    /**
     * @param timeout null waits indefinitely
     * @return true if the worker thread has exited
     */
    public boolean awaitTermination(Duration timeout) {
        Thread t = worker;
        if (!started.get() || t == null) {
            return true;
        }
        try {
            if (timeout == null) {
                t.join();
            } else {
                t.join(Math.max(1, timeout.toMillis()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    private void setState(RunState newState) {
        lock.lock();
        try {
            if (state == newState) {
                return;
            }
            state = newState;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        for (WorkQueueListener l : listeners) {
            try {
                l.onStateChanged(newState);
            } catch (RuntimeException e) {
                log.warn("backup4j work queue listener failed state={} msg={}", newState, e.getMessage(), e);
            }
        }
    }

    private void fireQueueChanged() {
        for (WorkQueueListener l : listeners) {
            try {
                l.onQueueChanged();
            } catch (RuntimeException e) {
                log.warn("backup4j work queue listener failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void fireTasksRemoved(List<JobRequest> removed) {
        for (JobRequest job : removed) {
            for (WorkQueueListener l : listeners) {
                try {
                    l.onTaskRemoved(job);
                } catch (RuntimeException e) {
                    log.warn("backup4j work queue listener failed taskId={} msg={}", job.taskId(), e.getMessage(), e);
                }
            }
        }
    }

    private void runLoop() {
        while (!terminated) {
            JobRequest job;
            lock.lock();
            try {
                while (!terminated && (state == RunState.PAUSED || tasks.isEmpty())) {
                    signal.await(IDLE_WAIT_MINUTES, TimeUnit.MINUTES);
                }
                if (terminated) {
                    return;
                }
                job = tasks.pollFirst();
                currentTask = job;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }

            process(job);
        }
    }

    private void process(JobRequest job) {
        for (WorkQueueListener l : listeners) {
            try {
                l.onWorkStarting(job);
            } catch (RuntimeException e) {
                log.warn("backup4j work queue listener failed taskId={} msg={}", job.taskId(), e.getMessage(), e);
            }
        }

        Throwable error = null;
        try {
            executor.execute(job);
        } catch (Throwable e) {
            // Errors included: one job must never take the worker down
            error = e;
            log.error("backup4j job failed taskId={} operation={} backupId={} msg={}",
                    job.taskId(), job.operation(), job.backupId(), e.getMessage(), e);
            for (WorkQueueListener l : listeners) {
                try {
                    l.onError(job, e);
                } catch (RuntimeException le) {
                    log.warn("backup4j work queue listener failed taskId={} msg={}", job.taskId(), le.getMessage(), le);
                }
            }
        } finally {
            lock.lock();
            try {
                currentTask = null;
            } finally {
                lock.unlock();
            }
        }

        job.markFinished(error == null ? JobState.COMPLETED : JobState.FAILED, clock.instant());

        for (WorkQueueListener l : listeners) {
            try {
                l.onWorkCompleted(job, error);
            } catch (RuntimeException e) {
                log.warn("backup4j work queue listener failed taskId={} msg={}", job.taskId(), e.getMessage(), e);
            }
        }
    }
}
