package com.signalledger.watcher.support;

import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingPublisher implements SignalNotificationPublisher {

    private final List<SignalNotification> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(SignalNotification notification) {
        published.add(notification);
    }

    public List<SignalNotification> published() {
        return List.copyOf(published);
    }
}
