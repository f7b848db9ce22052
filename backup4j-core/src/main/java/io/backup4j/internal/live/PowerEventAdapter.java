package io.backup4j.internal.live;

import io.backup4j.core.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Translates system suspend/resume notifications into pause and resume calls.
 * <p>
 * On suspend a running server is paused indefinitely; a timed pause is made indefinite and its deadline
 * remembered. On wake the remaining pause time is restored, but never shorter than the startup delay.
 */
public class PowerEventAdapter {

    private static final Logger log = LoggerFactory.getLogger(PowerEventAdapter.class);

    private final LiveControls controls;
    private final Clock clock;

    private boolean suspended;
    private Instant suspendedUntil;

    public PowerEventAdapter(LiveControls controls, Clock clock) {
        this.controls = Objects.requireNonNull(controls, "controls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void onSuspend() {
        try {
            if (controls.state() == RunState.PAUSED) {
                Instant deadline = controls.estimatedPauseEnd();
                if (deadline == null) {
                    // already paused indefinitely, the user resumes manually
                    return;
                }
                suspendedUntil = deadline;
            } else {
                suspendedUntil = null;
            }
            suspended = true;
            controls.pause();
        } catch (RuntimeException e) {
            log.warn("backup4j suspend handling failed msg={}", e.getMessage(), e);
        }
    }

    public synchronized void onResume() {
        if (!suspended) {
            return;
        }
        suspended = false;
        try {
            Instant now = clock.instant();
            Duration remaining = suspendedUntil == null ? Duration.ZERO : Duration.between(now, suspendedUntil);
            Duration startupDelay = controls.startupDelay();
            if (startupDelay.compareTo(remaining) > 0) {
                remaining = startupDelay;
            }
            suspendedUntil = null;

            if (remaining.isNegative() || remaining.isZero()) {
                controls.resume();
            } else {
                log.info("backup4j system resumed, staying paused remaining={}", remaining);
                controls.pause(remaining);
            }
        } catch (RuntimeException e) {
            log.warn("backup4j resume handling failed msg={}", e.getMessage(), e);
        }
    }
}
