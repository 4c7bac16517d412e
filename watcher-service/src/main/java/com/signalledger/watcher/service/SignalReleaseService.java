package com.signalledger.watcher.service;

import com.signalledger.common.confidence.ConfidenceRefiner;
import com.signalledger.common.confidence.ReleaseScore;
import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.SignalStatus;
import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;
import com.signalledger.common.store.SignalStore;
import com.signalledger.common.validation.CandleValidator;
import com.signalledger.common.validation.SignalInvariants;
import com.signalledger.watcher.config.WatcherSettings;
import com.signalledger.watcher.dto.ReleaseDecision;
import com.signalledger.watcher.dto.SignalDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Release gate between signal generation and the lifecycle.
 *
 * <pre>
 *   validate levels → refine confidence → below threshold: reject, persist nothing
 *                                       → otherwise: insert CANDIDATE → WAITING_FOR_ENTRY → notify
 * </pre>
 *
 * <p>The insert and the release transition commit together, so a failed release never
 * leaves a CANDIDATE row behind. The notification is sent only after the commit.
 */
@Service
public class SignalReleaseService {

    private static final Logger log = LoggerFactory.getLogger(SignalReleaseService.class);

    private final SignalStore store;
    private final CandleFeed feed;
    private final ConfidenceRefiner refiner;
    private final SignalNotificationPublisher publisher;
    private final WatcherSettings settings;
    private final Clock clock;

    public SignalReleaseService(SignalStore store, CandleFeed feed, ConfidenceRefiner refiner,
                                SignalNotificationPublisher publisher, WatcherSettings settings, Clock clock) {
        this.store     = store;
        this.feed      = feed;
        this.refiner   = refiner;
        this.publisher = publisher;
        this.settings  = settings;
        this.clock     = clock;
    }

    /**
     * @return a decision; errors with {@link com.signalledger.common.exception.InvariantViolationException}
     *         when the draft's levels are inconsistent
     */
    public Mono<ReleaseDecision> release(SignalDraft draft) {
        return Mono.defer(() -> {
            SignalInvariants.validate(draft.direction(), draft.entryPrice(), draft.tp(), draft.sl());
            Instant now = clock.instant();
            return recentCandles(draft)
                .map(candles -> refiner.calculateReleaseScore(draft.rawConfidence(), now, candles))
                .flatMap(score -> score.meets(settings.publishThreshold())
                    ? publish(draft, score, now)
                    : Mono.just(reject(draft, score)));
        });
    }

    private Mono<List<Candle>> recentCandles(SignalDraft draft) {
        return feed.fetchCandles(draft.asset(), draft.timeframe(), refiner.settings().volatilityLookback() + 1)
            .map(candles -> CandleValidator.sanitize(candles).valid())
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Release scoring without volatility context. asset={} reason={}", draft.asset(), e.getMessage());
                return Mono.just(List.of());
            });
    }

    private ReleaseDecision reject(SignalDraft draft, ReleaseScore score) {
        log.info("RELEASE_REJECTED asset={} direction={} score={} threshold={} {}",
                 draft.asset(), draft.direction(), score.score(), settings.publishThreshold(), score.explanation());
        return ReleaseDecision.rejected(score, settings.publishThreshold());
    }

    private Mono<ReleaseDecision> publish(SignalDraft draft, ReleaseScore score, Instant now) {
        Signal candidate = new Signal(null, draft.asset(), draft.timeframe(), draft.direction(),
            draft.entryPrice(), draft.tp(), draft.sl(),
            SignalInvariants.rewardRiskRatio(draft.entryPrice(), draft.tp(), draft.sl()),
            draft.rawConfidence(), score.score(),
            SignalState.CANDIDATE, SignalStatus.ACTIVE, null,
            now, now.plus(settings.entryWindow()), null, null, null, false);

        String reason = "release score " + score.score() + " (" + score.explanation() + ")";
        Mono<Released> unit = store.insert(candidate)
            .flatMap(saved -> store.applyTransition(SignalTransition.release(saved, reason), now)
                .map(applied -> new Released(saved, applied)));

        return store.inTransaction(unit)
            .doOnError(e -> log.error("RELEASE_FAILED asset={} direction={} (rolled back)",
                                      draft.asset(), draft.direction(), e))
            .flatMap(released -> {
                Signal saved = released.signal();
                if (!released.applied()) {
                    log.warn("RELEASE_GUARD_LOST id={} (signal changed before release)", saved.id());
                    return Mono.just(new ReleaseDecision(false, score, settings.publishThreshold(), saved,
                                                         "signal changed state before release"));
                }
                publisher.publish(SignalNotification.of(saved, SignalState.WAITING_FOR_ENTRY));
                log.info("SIGNAL_RELEASED id={} asset={} direction={} entry={} tp={} sl={} score={} expiresAt={}",
                         saved.id(), saved.asset(), saved.direction(), saved.entryPrice(), saved.tp(),
                         saved.sl(), score.score(), saved.expiresAt());
                return store.findById(saved.id())
                    .map(current -> new ReleaseDecision(true, score, settings.publishThreshold(), current,
                                                        "released"));
            });
    }

    private record Released(Signal signal, boolean applied) {}
}
