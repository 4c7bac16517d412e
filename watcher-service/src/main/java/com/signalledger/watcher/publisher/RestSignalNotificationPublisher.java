package com.signalledger.watcher.publisher;

import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends {@link SignalNotification}s to the notification service via HTTP POST
 * (fire-and-forget). No reactor thread is ever blocked; a failed delivery is logged
 * and never rolls back the transition that caused it.
 */
@Component
public class RestSignalNotificationPublisher implements SignalNotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestSignalNotificationPublisher.class);

    private final WebClient notificationClient;

    public RestSignalNotificationPublisher(@Qualifier("notificationClient") WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(SignalNotification notification) {
        notificationClient.post()
            .uri("/api/v1/notify/signal")
            .bodyValue(notification)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Signal notification published. signalId={} state={} status={}",
                                notification.signalId(), notification.newState(), r.getStatusCode()),
                err -> log.warn("Signal notification failed (non-critical). signalId={} state={}",
                                notification.signalId(), notification.newState(), err)
            );
    }
}
