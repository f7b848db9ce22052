package io.backup4j.internal.events;

import io.backup4j.core.EventKind;
import io.backup4j.core.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Monotonic change counter with long-poll support.
 * <p>
 * Every signal increments the counter, wakes all waiters and is kept in a bounded buffer of recent events.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object lock = new Object();
    private final ArrayDeque<ServerEvent> recent;
    private final int capacity;
    private final Clock clock;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    private long eventId;

    public EventBus(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.recent = new ArrayDeque<>(capacity);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void addListener(EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public long signalNewEvent() {
        return signalNewEvent(EventKind.STATE_CHANGED, null);
    }

    public long signalNewEvent(EventKind kind, String subject) {
        ServerEvent event;
        synchronized (lock) {
            event = new ServerEvent(++eventId, kind, subject, clock.instant());
            recent.addLast(event);
            while (recent.size() > capacity) {
                recent.removeFirst();
            }
            lock.notifyAll();
        }

        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("backup4j event listener failed id={} kind={} msg={}", event.id(), kind, e.getMessage(), e);
            }
        }
        return event.id();
    }

    public long lastEventId() {
        synchronized (lock) {
            return eventId;
        }
    }

    /**
     * Block until the counter differs from {@code lastKnownId} or the timeout elapses.
     * Returns immediately if a change already happened.
     */
    public long waitForChange(long lastKnownId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
        synchronized (lock) {
            while (eventId == lastKnownId) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
            }
            return eventId;
        }
    }

    /**
     * Events newer than {@code sinceId} that are still buffered, oldest first.
     */
    public List<ServerEvent> eventsSince(long sinceId) {
        synchronized (lock) {
            List<ServerEvent> out = new ArrayList<>();
            for (ServerEvent e : recent) {
                if (e.id() > sinceId) {
                    out.add(e);
                }
            }
            return out;
        }
    }
}
