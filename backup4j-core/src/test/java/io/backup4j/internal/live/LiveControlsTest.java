package io.backup4j.internal.live;

import io.backup4j.core.ApplicationSettings;
import io.backup4j.core.RunState;
import io.backup4j.core.ThreadPriority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class LiveControlsTest {

    private final List<RunState> stateEvents = new CopyOnWriteArrayList<>();
    private final List<Object> otherEvents = new CopyOnWriteArrayList<>();
    private LiveControls controls;

    @BeforeEach
    void setUp() {
        controls = new LiveControls(Clock.systemUTC());
        controls.addListener(new LiveControlListener() {
            @Override
            public void onStateChanged(RunState state) {
                stateEvents.add(state);
            }

            @Override
            public void onThreadPriorityChanged(ThreadPriority priority) {
                otherEvents.add(priority);
            }

            @Override
            public void onThrottleSpeedChanged(Long uploadLimit, Long downloadLimit) {
                otherEvents.add(uploadLimit + "/" + downloadLimit);
            }
        });
    }

    @AfterEach
    void tearDown() {
        controls.close();
    }

    @Test
    void indefinitePauseShouldNotifyOnce() {
        controls.pause();
        controls.pause();

        assertEquals(List.of(RunState.PAUSED), stateEvents);
        assertEquals(RunState.PAUSED, controls.state());
        assertNull(controls.estimatedPauseEnd());
    }

    @Test
    void timedPauseShouldRenotifyWhenAlreadyPaused() {
        controls.pause(Duration.ofMinutes(10));
        controls.pause(Duration.ofMinutes(20));

        assertEquals(List.of(RunState.PAUSED, RunState.PAUSED), stateEvents);
        assertNotNull(controls.estimatedPauseEnd());
    }

    @Test
    void indefinitePauseDuringTimedPauseShouldClearDeadlineAndRenotify() {
        controls.pause(Duration.ofMinutes(10));
        controls.pause();

        assertEquals(List.of(RunState.PAUSED, RunState.PAUSED), stateEvents);
        assertNull(controls.estimatedPauseEnd());
    }

    @Test
    void resumeShouldOnlyActWhenPaused() {
        controls.resume();
        assertEquals(List.of(), stateEvents);

        controls.pause();
        controls.resume();
        assertEquals(List.of(RunState.PAUSED, RunState.RUNNING), stateEvents);
    }

    @Test
    void timedPauseShouldResumeAutomatically() throws Exception {
        controls.pause(Duration.ofMillis(100));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (controls.state() == RunState.PAUSED && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(RunState.RUNNING, controls.state());
        assertEquals(List.of(RunState.PAUSED, RunState.RUNNING), stateEvents);
    }

    @Test
    void resumeShouldCancelPendingTimer() throws Exception {
        controls.pause(Duration.ofMillis(150));
        controls.resume();
        controls.pause();

        Thread.sleep(400);

        assertEquals(RunState.PAUSED, controls.state());
        assertEquals(List.of(RunState.PAUSED, RunState.RUNNING, RunState.PAUSED), stateEvents);
    }

    @Test
    void settersShouldNotifyOnlyOnChange() {
        controls.setThreadPriority(ThreadPriority.LOWEST);
        controls.setThreadPriority(ThreadPriority.LOWEST);
        controls.setUploadLimit(1024L);
        controls.setUploadLimit(1024L);
        controls.setDownloadLimit(null);

        assertEquals(List.of(ThreadPriority.LOWEST, "1024/null"), otherEvents);
    }

    @Test
    void startupDelayShouldStartPaused() {
        controls.configure(new ApplicationSettings(null, null, null, "5m", ThreadPriority.BELOW_NORMAL, "100", "2mb", null));

        assertEquals(RunState.PAUSED, controls.state());
        assertNotNull(controls.estimatedPauseEnd());
        assertEquals(Duration.ofMinutes(5), controls.startupDelay());
        assertEquals(ThreadPriority.BELOW_NORMAL, controls.threadPriority());
        assertEquals(100 * 1024L, controls.uploadLimit());
        assertEquals(2 * 1024 * 1024L, controls.downloadLimit());
    }

    @Test
    void invalidSpeedLimitShouldBeIgnored() {
        controls.configure(new ApplicationSettings(null, null, null, null, null, "fast", null, null));

        assertEquals(RunState.RUNNING, controls.state());
        assertNull(controls.uploadLimit());
    }

    @Test
    void pauseStringShouldAcceptIntervals() {
        controls.pause("15m");
        assertNotNull(controls.estimatedPauseEnd());

        controls.pause("");
        assertNull(controls.estimatedPauseEnd());
        assertEquals(RunState.PAUSED, controls.state());
    }
}
