package io.backup4j;

import io.backup4j.core.Notification;

/**
 * Stores user-visible notifications.
 */
public interface NotificationSink {

    void register(Notification notification);
}
