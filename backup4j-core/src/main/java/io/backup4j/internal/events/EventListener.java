package io.backup4j.internal.events;

import io.backup4j.core.ServerEvent;

/**
 * Must not block; called on the thread that signalled the event.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(ServerEvent event);
}
