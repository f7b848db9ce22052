package io.backup4j.testing;

import io.backup4j.NotificationSink;
import io.backup4j.core.Notification;
import io.backup4j.core.NotificationSeverity;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationSink implements NotificationSink {

    public final List<Notification> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void register(Notification notification) {
        notifications.add(notification);
    }

    public List<Notification> withSeverity(NotificationSeverity severity) {
        return notifications.stream().filter(n -> n.severity() == severity).toList();
    }
}
