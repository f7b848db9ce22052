package io.backup4j.core;

import io.backup4j.EngineController;
import io.backup4j.ProgressSink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One unit of work for the queue.
 *
 * <p>The engine controller slot is written only by the runner and guarded by this object's own
 * monitor, so stop/pause/throttle requests from other threads never see a half attached controller.
 */
public final class JobRequest {

    private static final AtomicLong TASK_IDS = new AtomicLong();

    private final long taskId;
    private final OperationKind operation;
    private final BackupDefinition backup;
    private final Map<String, String> extraOptions;
    private final List<String> filterStrings;
    private final List<String> extraArguments;
    private final int pageOffset;
    private final int pageSize;
    private final Consumer<ProgressSink> customAction;
    private final Consumer<JobRequest> afterFinished;

    private EngineController controller;
    private long jobUploadLimit;
    private long jobDownloadLimit;
    private StopReason stopReason = StopReason.NONE;
    private boolean stopRequested;

    private volatile JobState state = JobState.CREATED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    private JobRequest(Builder b) {
        this.taskId = TASK_IDS.incrementAndGet();
        this.operation = b.operation;
        this.backup = b.backup;
        this.extraOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.extraOptions));
        this.filterStrings = List.copyOf(b.filterStrings);
        this.extraArguments = List.copyOf(b.extraArguments);
        this.pageOffset = b.pageOffset;
        this.pageSize = b.pageSize;
        this.customAction = b.customAction;
        this.afterFinished = b.afterFinished;
    }

    public static Builder builder(OperationKind operation, BackupDefinition backup) {
        return new Builder(operation, backup);
    }

    public static JobRequest backup(BackupDefinition backup) {
        return builder(OperationKind.BACKUP, backup).build();
    }

    /**
     * A job that runs arbitrary code on the worker thread instead of calling the engine.
     */
    public static JobRequest custom(Consumer<ProgressSink> action) {
        Objects.requireNonNull(action, "action must not be null");
        return new Builder(OperationKind.CUSTOM, null).customAction(action).build();
    }

    public long taskId() {
        return taskId;
    }

    public OperationKind operation() {
        return operation;
    }

    public BackupDefinition backup() {
        return backup;
    }

    public String backupId() {
        return backup == null ? null : backup.id();
    }

    public Map<String, String> extraOptions() {
        return extraOptions;
    }

    public List<String> filterStrings() {
        return filterStrings;
    }

    public List<String> extraArguments() {
        return extraArguments;
    }

    public int pageOffset() {
        return pageOffset;
    }

    public int pageSize() {
        return pageSize;
    }

    public Consumer<ProgressSink> customAction() {
        return customAction;
    }

    public Consumer<JobRequest> afterFinished() {
        return afterFinished;
    }

    public JobState state() {
        return state;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public void markQueued() {
        if (state == JobState.CREATED) {
            state = JobState.QUEUED;
        }
    }

    public void markStarted(Instant at) {
        state = JobState.RUNNING;
        startedAt = at;
    }

    /**
     * Move to a terminal state. The first terminal state wins.
     */
    public void markFinished(JobState terminal, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("state is not terminal: " + terminal);
        }
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = terminal;
            finishedAt = at;
        }
    }

    /**
     * @param uploadLimit   the job's own {@code throttle-upload}, 0 for none
     * @param downloadLimit the job's own {@code throttle-download}, 0 for none
     */
    public synchronized void attachController(EngineController engineController, long uploadLimit, long downloadLimit) {
        this.controller = Objects.requireNonNull(engineController, "engineController must not be null");
        this.jobUploadLimit = uploadLimit;
        this.jobDownloadLimit = downloadLimit;
        if (stopRequested) {
            engineController.stop();
        }
    }

    public synchronized void detachController() {
        controller = null;
    }

    public synchronized boolean hasController() {
        return controller != null;
    }

    /**
     * Graceful stop. If a stop was already requested the operation is aborted instead.
     */
    public void stop(StopReason reason) {
        synchronized (this) {
            stopReason = reason == null ? StopReason.NONE : reason;
            boolean escalate = stopRequested || (controller != null && controller.isStopRequested());
            stopRequested = true;
            if (controller == null) {
                return;
            }
            if (escalate) {
                controller.abort();
            } else {
                controller.stop();
            }
        }
    }

    public void abort(StopReason reason) {
        synchronized (this) {
            stopReason = reason == null ? StopReason.NONE : reason;
            stopRequested = true;
            if (controller != null) {
                controller.abort();
            }
        }
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    public synchronized StopReason stopReason() {
        return stopReason;
    }

    public synchronized void pause() {
        if (controller != null) {
            controller.pause();
        }
    }

    public synchronized void resume() {
        if (controller != null) {
            controller.resume();
        }
    }

    /**
     * Push the effective limits: the lower of the job's own limit and the server limit, 0 meaning unlimited.
     */
    public synchronized void updateThrottleSpeeds(Long serverUpload, Long serverDownload) {
        if (controller != null) {
            controller.setThrottleSpeeds(
                    effectiveLimit(jobUploadLimit, serverUpload),
                    effectiveLimit(jobDownloadLimit, serverDownload));
        }
    }

    public synchronized void applyThreadPriority(ThreadPriority priority) {
        if (controller != null) {
            controller.setThreadPriority(priority);
        }
    }

    static long effectiveLimit(long jobLimit, Long serverLimit) {
        long job = jobLimit <= 0 ? Long.MAX_VALUE : jobLimit;
        long server = serverLimit == null || serverLimit <= 0 ? Long.MAX_VALUE : serverLimit;
        long min = Math.min(job, server);
        return min == Long.MAX_VALUE ? 0 : min;
    }

    @Override
    public String toString() {
        return "JobRequest{taskId=" + taskId + ", operation=" + operation + ", backupId=" + backupId() + ", state=" + state + "}";
    }

    public static final class Builder {
        private final OperationKind operation;
        private final BackupDefinition backup;
        private final Map<String, String> extraOptions = new LinkedHashMap<>();
        private final List<String> filterStrings = new ArrayList<>();
        private final List<String> extraArguments = new ArrayList<>();
        private int pageOffset;
        private int pageSize;
        private Consumer<ProgressSink> customAction;
        private Consumer<JobRequest> afterFinished;

        private Builder(OperationKind operation, BackupDefinition backup) {
            this.operation = Objects.requireNonNull(operation, "operation must not be null");
            if (operation != OperationKind.CUSTOM) {
                Objects.requireNonNull(backup, "backup must not be null");
            }
            this.backup = backup;
        }

        public Builder extraOption(String name, String value) {
            extraOptions.put(Objects.requireNonNull(name, "name must not be null"), value);
            return this;
        }

        public Builder extraOptions(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::extraOption);
            }
            return this;
        }

        public Builder filterStrings(List<String> values) {
            if (values != null) {
                filterStrings.addAll(values);
            }
            return this;
        }

        public Builder extraArguments(List<String> values) {
            if (values != null) {
                extraArguments.addAll(values);
            }
            return this;
        }

        public Builder page(int offset, int size) {
            if (offset < 0 || size < 0) {
                throw new IllegalArgumentException("page offset and size must not be negative");
            }
            this.pageOffset = offset;
            this.pageSize = size;
            return this;
        }

        public Builder customAction(Consumer<ProgressSink> action) {
            this.customAction = action;
            return this;
        }

        public Builder afterFinished(Consumer<JobRequest> callback) {
            this.afterFinished = callback;
            return this;
        }

        public JobRequest build() {
            if (operation == OperationKind.CUSTOM && customAction == null) {
                throw new IllegalArgumentException("custom job requires an action");
            }
            return new JobRequest(this);
        }
    }
}
