package com.signalledger.common.notification;

/**
 * Outbound channel for signal notifications.
 *
 * <p>Implementations must be fire-and-forget: publish failures are logged and
 * swallowed, never propagated back into the lifecycle pipeline.
 */
public interface SignalNotificationPublisher {

    void publish(SignalNotification notification);
}
