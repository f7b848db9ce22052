package io.backup4j.internal.runner;

import io.backup4j.EngineOperation;
import io.backup4j.core.EngineOutcome;
import io.backup4j.core.JobRequest;

/**
 * Runs a prepared operation and classifies how it ended. Never throws.
 * <p>
 * An exception raised after the job was asked to stop counts as an abort with the job's stop reason;
 * any other exception is a failure.
 */
final class EngineInvoker {

    EngineOutcome invoke(JobRequest job, EngineOperation operation) {
        try {
            return EngineOutcome.ok(operation.execute());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EngineOutcome.aborted(job.stopReason(), e);
        } catch (Exception e) {
            if (job.isStopRequested()) {
                return EngineOutcome.aborted(job.stopReason(), e);
            }
            return EngineOutcome.failed(e);
        }
    }
}
