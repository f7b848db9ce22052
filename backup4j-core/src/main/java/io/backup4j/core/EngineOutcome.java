package io.backup4j.core;

import java.util.Objects;

/**
 * What came back across the engine boundary.
 */
public record EngineOutcome(OutcomeKind kind, EngineResult result, Throwable error, StopReason stopReason) {

    public EngineOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
        stopReason = stopReason == null ? StopReason.NONE : stopReason;
    }

    public static EngineOutcome ok(EngineResult result) {
        return new EngineOutcome(OutcomeKind.OK, result, null, StopReason.NONE);
    }

    public static EngineOutcome failed(Throwable error) {
        return new EngineOutcome(OutcomeKind.FAILED, null, error, StopReason.NONE);
    }

    public static EngineOutcome aborted(StopReason reason, Throwable error) {
        OutcomeKind kind = reason.initiatedBySystem() ? OutcomeKind.ABORTED_BY_SYSTEM : OutcomeKind.ABORTED_BY_USER;
        return new EngineOutcome(kind, null, error, reason);
    }
}
