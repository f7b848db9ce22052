package io.backup4j.internal.live;

import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.RunState;
import io.backup4j.core.ThreadPriority;
import io.backup4j.utils.IntervalParser;
import io.backup4j.utils.SizeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide run state, pause timer and overrides that reach running operations.
 * <p>
 * Rules:
 * <ul>
 *   <li>{@link #pause()} while timed-paused turns the pause indefinite and re-notifies.</li>
 *   <li>{@link #pause()} while running notifies; while indefinitely paused it does nothing.</li>
 *   <li>{@link #pause(Duration)} always re-arms the timer; it re-notifies when already paused.</li>
 *   <li>{@link #resume()} only acts when paused and always cancels the timer.</li>
 * </ul>
 */
public class LiveControls implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveControls.class);

    private final Object lock = new Object();
    private final Clock clock;
    // created on demand so a closed instance can be configured again
    private ScheduledExecutorService timer;
    private final List<LiveControlListener> listeners = new CopyOnWriteArrayList<>();

    private RunState state = RunState.RUNNING;
    private Instant pauseDeadline;
    private ScheduledFuture<?> resumeFuture;
    private long timerGeneration;

    private ThreadPriority threadPriority;
    private Long uploadLimit;
    private Long downloadLimit;
    private Duration startupDelay = Duration.ZERO;

    public LiveControls(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void addListener(LiveControlListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Seed from application settings. A positive startup delay starts paused with auto-resume armed.
     */
    public void configure(ApplicationSettings settings) {
        ApplicationSettings s = settings == null ? ApplicationSettings.defaults() : settings;
        synchronized (lock) {
            startupDelay = parseDelay(s.startupDelay());
            threadPriority = s.threadPriority();
            uploadLimit = parseSpeed(s.uploadSpeedLimit(), "upload");
            downloadLimit = parseSpeed(s.downloadSpeedLimit(), "download");

            if (!startupDelay.isZero()) {
                log.info("backup4j starting paused startupDelay={}", startupDelay);
                pause(startupDelay);
            }
        }
    }

    public RunState state() {
        synchronized (lock) {
            return state;
        }
    }

    public Instant estimatedPauseEnd() {
        synchronized (lock) {
            return pauseDeadline;
        }
    }

    public Duration startupDelay() {
        synchronized (lock) {
            return startupDelay;
        }
    }

    public ThreadPriority threadPriority() {
        synchronized (lock) {
            return threadPriority;
        }
    }

    public Long uploadLimit() {
        synchronized (lock) {
            return uploadLimit;
        }
    }

    public Long downloadLimit() {
        synchronized (lock) {
            return downloadLimit;
        }
    }

    public void pause() {
        synchronized (lock) {
            boolean timed = pauseDeadline != null && state == RunState.PAUSED;
            resetTimer();
            if (timed) {
                fireStateChanged();
            } else {
                setPaused();
            }
        }
    }

    public void pause(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        synchronized (lock) {
            resetTimer();
            pauseDeadline = clock.instant().plus(duration);
            long generation = timerGeneration;
            resumeFuture = timer().schedule(() -> onTimerElapsed(generation),
                    Math.max(0, duration.toMillis()), TimeUnit.MILLISECONDS);

            if (state == RunState.PAUSED) {
                fireStateChanged();
            } else {
                setPaused();
            }
        }
    }

    /**
     * Pause for an interval expression such as "15m"; blank means indefinitely.
     */
    public void pause(String duration) {
        if (duration == null || duration.isBlank()) {
            pause();
            return;
        }
        Duration d = IntervalParser.parseDuration(duration);
        if (d.isZero()) {
            pause();
        } else {
            pause(d);
        }
    }

    public void resume() {
        synchronized (lock) {
            if (state != RunState.PAUSED) {
                return;
            }
            resetTimer();
            state = RunState.RUNNING;
            fireStateChanged();
        }
    }

    public void setThreadPriority(ThreadPriority priority) {
        synchronized (lock) {
            if (Objects.equals(threadPriority, priority)) {
                return;
            }
            threadPriority = priority;
            for (LiveControlListener l : listeners) {
                try {
                    l.onThreadPriorityChanged(priority);
                } catch (RuntimeException e) {
                    log.warn("backup4j live control listener failed priority={} msg={}", priority, e.getMessage(), e);
                }
            }
        }
    }

    public void setUploadLimit(Long bytesPerSecond) {
        synchronized (lock) {
            if (Objects.equals(uploadLimit, bytesPerSecond)) {
                return;
            }
            uploadLimit = bytesPerSecond;
            fireThrottleChanged();
        }
    }

    public void setDownloadLimit(Long bytesPerSecond) {
        synchronized (lock) {
            if (Objects.equals(downloadLimit, bytesPerSecond)) {
                return;
            }
            downloadLimit = bytesPerSecond;
            fireThrottleChanged();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            resetTimer();
            if (timer != null) {
                timer.shutdownNow();
                timer = null;
            }
        }
    }

    private ScheduledExecutorService timer() {
        if (timer == null) {
            timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "backup4j.live-control");
                t.setDaemon(true);
                return t;
            });
        }
        return timer;
    }

    private void onTimerElapsed(long generation) {
        synchronized (lock) {
            // a newer pause or resume replaced this timer
            if (generation != timerGeneration) {
                return;
            }
            log.info("backup4j pause period elapsed, resuming");
            resume();
        }
    }

    private void setPaused() {
        if (state == RunState.RUNNING) {
            state = RunState.PAUSED;
            fireStateChanged();
        }
    }

    private void resetTimer() {
        timerGeneration++;
        pauseDeadline = null;
        if (resumeFuture != null) {
            resumeFuture.cancel(false);
            resumeFuture = null;
        }
    }

    private void fireStateChanged() {
        for (LiveControlListener l : listeners) {
            try {
                l.onStateChanged(state);
            } catch (RuntimeException e) {
                log.warn("backup4j live control listener failed state={} msg={}", state, e.getMessage(), e);
            }
        }
    }

    private void fireThrottleChanged() {
        for (LiveControlListener l : listeners) {
            try {
                l.onThrottleSpeedChanged(uploadLimit, downloadLimit);
            } catch (RuntimeException e) {
                log.warn("backup4j live control listener failed msg={}", e.getMessage(), e);
            }
        }
    }

    private static Duration parseDelay(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        try {
            Duration d = IntervalParser.parseDuration(value);
            return d.isNegative() ? Duration.ZERO : d;
        } catch (IllegalArgumentException e) {
            log.warn("backup4j ignoring invalid startup delay value={} msg={}", value, e.getMessage());
            return Duration.ZERO;
        }
    }

    private static Long parseSpeed(String value, String direction) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SizeParser.parseSize(value, "kb");
        } catch (IllegalArgumentException e) {
            log.warn("backup4j ignoring invalid {} speed limit value={} msg={}", direction, value, e.getMessage());
            return null;
        }
    }
}
