package io.backup4j.core;

import java.time.Instant;
import java.util.List;

/**
 * The "current state" snapshot served to polling clients.
 */
public record ServerState(
        RunState programState,
        Instant estimatedPauseEnd,
        TaskInfo activeTask,
        List<TaskInfo> pendingTasks,
        long lastEventId,
        ProgressSnapshot lastProgress,
        List<ProposedRun> proposedSchedule,
        ThreadPriority threadPriority,
        Long uploadLimit,
        Long downloadLimit
) {

    public ServerState {
        pendingTasks = pendingTasks == null ? List.of() : List.copyOf(pendingTasks);
        proposedSchedule = proposedSchedule == null ? List.of() : List.copyOf(proposedSchedule);
    }

    public record TaskInfo(long taskId, String backupId, OperationKind operation) {

        public static TaskInfo of(JobRequest job) {
            return new TaskInfo(job.taskId(), job.backupId(), job.operation());
        }
    }
}
