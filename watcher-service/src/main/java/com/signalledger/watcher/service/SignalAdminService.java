package com.signalledger.watcher.service;

import com.signalledger.common.exception.StaleSignalException;
import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.lifecycle.LifecycleEvaluator;
import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Signal;
import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;
import com.signalledger.common.store.SignalStore;
import com.signalledger.watcher.dto.SignalSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Operator actions on individual signals. Every write goes through the same guarded
 * store update as the watcher, so an operator racing the loop never double-applies.
 * An empty result means the signal does not exist.
 */
@Service
public class SignalAdminService {

    private static final Logger log = LoggerFactory.getLogger(SignalAdminService.class);

    private final SignalStore store;
    private final CandleFeed feed;
    private final LifecycleEvaluator evaluator;
    private final SignalNotificationPublisher publisher;
    private final Clock clock;

    public SignalAdminService(SignalStore store, CandleFeed feed, LifecycleEvaluator evaluator,
                              SignalNotificationPublisher publisher, Clock clock) {
        this.store     = store;
        this.feed      = feed;
        this.evaluator = evaluator;
        this.publisher = publisher;
        this.clock     = clock;
    }

    /**
     * Explicit administrative cancel.
     *
     * @throws IllegalStateException (as error signal) when the signal is terminal or
     *         changed state concurrently
     */
    public Mono<Signal> cancel(long id, String reason) {
        return store.findById(id)
            .flatMap(signal -> {
                Instant now = clock.instant();
                SignalTransition t = SignalTransition.cancel(signal, now,
                    "operator cancel: " + (reason == null || reason.isBlank() ? "no reason given" : reason));
                return store.applyTransition(t, now)
                    .flatMap(applied -> {
                        if (!applied) {
                            return Mono.<Signal>error(new IllegalStateException(
                                "signal " + id + " left state " + signal.state() + " concurrently"));
                        }
                        log.warn("SIGNAL_CANCELLED id={} from={} reason={}", id, signal.state(), t.reason());
                        publisher.publish(SignalNotification.of(signal, t.newState()));
                        return store.findById(id);
                    });
            });
    }

    /**
     * Records that an operator has looked at the signal, pushing back zombie
     * reclamation. A signal already past the staleness threshold is refused with
     * {@link StaleSignalException}; it can only be cancelled.
     */
    public Mono<Signal> acknowledge(long id) {
        return store.findById(id)
            .flatMap(signal -> {
                Instant now = clock.instant();
                if (signal.isTerminal()) {
                    return Mono.<Signal>error(new IllegalStateException("signal " + id + " is already " + signal.state()));
                }
                if (evaluator.isStale(signal, now)) {
                    return Mono.<Signal>error(new StaleSignalException(id,
                        Duration.between(signal.lastActivityAt(), now), evaluator.staleAfter()));
                }
                return store.acknowledge(id, signal.state(), now)
                    .flatMap(applied -> applied
                        ? store.findById(id)
                        : Mono.<Signal>error(new IllegalStateException(
                            "signal " + id + " left state " + signal.state() + " concurrently")))
                    .doOnSuccess(s -> log.info("SIGNAL_ACKNOWLEDGED id={} state={}", id, signal.state()));
            });
    }

    public Mono<SignalSnapshot> snapshot(long id) {
        return store.findById(id)
            .flatMap(signal -> Mono.zip(
                    feed.fetchLatestPrice(signal.asset())
                        .map(Optional::of)
                        .onErrorResume(e -> {
                            log.warn("Latest price unavailable for snapshot. id={} asset={}", id, signal.asset());
                            return Mono.just(Optional.empty());
                        })
                        .defaultIfEmpty(Optional.empty()),
                    store.findEvents(id).collectList())
                .map(tuple -> new SignalSnapshot(signal, tuple.getT1().orElse(null), tuple.getT2())));
    }
}
