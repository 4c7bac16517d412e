package com.signalledger.watcher.service;

import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.lifecycle.LifecycleEvaluator;
import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.TransitionCause;
import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;
import com.signalledger.common.outcome.Outcome;
import com.signalledger.common.outcome.OutcomeResolver;
import com.signalledger.common.store.SignalStore;
import com.signalledger.common.validation.CandleValidator;
import com.signalledger.watcher.config.WatcherSettings;
import com.signalledger.watcher.dto.BackfillReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Replays provider history over every entered signal of an asset.
 *
 * <p>Pending ENTRY_HIT signals whose outcome the history already decides are resolved
 * through the same {@link LifecycleEvaluator} and guarded store update as the live
 * loop. Closed signals are only compared: the report states how often the recorded
 * outcome agrees with a fresh replay, plus win rate and total R of the replay.
 */
@Service
public class OutcomeBackfillService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeBackfillService.class);

    private final SignalStore store;
    private final CandleFeed feed;
    private final LifecycleEvaluator evaluator;
    private final OutcomeResolver resolver;
    private final SignalNotificationPublisher publisher;
    private final WatcherSettings settings;
    private final Clock clock;

    public OutcomeBackfillService(SignalStore store, CandleFeed feed, LifecycleEvaluator evaluator,
                                  OutcomeResolver resolver, SignalNotificationPublisher publisher,
                                  WatcherSettings settings, Clock clock) {
        this.store     = store;
        this.feed      = feed;
        this.evaluator = evaluator;
        this.resolver  = resolver;
        this.publisher = publisher;
        this.settings  = settings;
        this.clock     = clock;
    }

    public Mono<BackfillReport> backfill(String asset) {
        Instant now = clock.instant();
        return store.findByAsset(asset)
            .filter(s -> s.entryHitAt() != null)
            .groupBy(Signal::timeframe)
            .flatMap(group -> feed.fetchCandles(asset, group.key(), settings.backfillLookback())
                .map(candles -> CandleValidator.sanitize(candles).valid())
                .flatMapMany(candles -> group.concatMap(signal -> replay(signal, candles, now))))
            .collectList()
            .map(entries -> BackfillReport.of(asset, entries))
            .doOnSuccess(r -> log.info("OUTCOME_BACKFILL asset={} replayed={} applied={} compared={} agreed={} winRate={} totalR={}",
                                       asset, r.replayed(), r.applied(), r.compared(), r.agreed(),
                                       r.winRate(), r.totalR()))
            .doOnError(e -> log.error("Outcome backfill failed. asset={}", asset, e));
    }

    private Mono<BackfillReport.Entry> replay(Signal signal, List<Candle> candles, Instant now) {
        Outcome replayed = resolver.resolveFromEntry(signal, candles).outcome();
        double r = resolver.computeRMultiple(replayed, signal);

        if (signal.state() == SignalState.ENTRY_HIT) {
            return evaluator.evaluate(signal, candles, now)
                .filter(t -> t.cause() == TransitionCause.MARKET)
                .map(t -> apply(signal, t, now)
                    .map(applied -> new BackfillReport.Entry(signal.id(), signal.state(), replayed, null, r, applied)))
                .orElseGet(() -> Mono.just(new BackfillReport.Entry(signal.id(), signal.state(), replayed, null, r, false)));
        }
        return Mono.just(new BackfillReport.Entry(signal.id(), signal.state(), replayed,
                                                  agreement(signal.state(), replayed), r, false));
    }

    private Mono<Boolean> apply(Signal signal, SignalTransition t, Instant now) {
        return store.applyTransition(t, now)
            .doOnNext(applied -> {
                if (applied) {
                    log.info("SIGNAL_TRANSITION id={} from={} to={} cause=BACKFILL candleTime={}",
                             signal.id(), t.expectedState(), t.newState(), t.evidence().timestamp());
                    publisher.publish(SignalNotification.of(signal, t.newState()));
                }
            });
    }

    /** {@code null} when the recorded state carries no market outcome to compare. */
    static Boolean agreement(SignalState recorded, Outcome replayed) {
        if (recorded == SignalState.TP_HIT) return replayed == Outcome.HIT_TP;
        if (recorded == SignalState.SL_HIT) return replayed == Outcome.HIT_SL;
        return null;
    }
}
