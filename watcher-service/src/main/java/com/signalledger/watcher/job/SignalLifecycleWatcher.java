package com.signalledger.watcher.job;

import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.lifecycle.LifecycleEvaluator;
import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.TransitionCause;
import com.signalledger.common.notification.SignalNotification;
import com.signalledger.common.notification.SignalNotificationPublisher;
import com.signalledger.common.store.SignalStore;
import com.signalledger.common.trace.TraceContextUtil;
import com.signalledger.common.validation.CandleValidator;
import com.signalledger.watcher.config.WatcherSettings;
import com.signalledger.watcher.health.WatcherHeartbeat;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polling loop that moves every non-terminal signal through its lifecycle using
 * nothing but observed candles.
 *
 * <pre>
 *   delay(pollInterval) → load non-terminal signals → fetch candles once per (asset, timeframe)
 *     → per signal: sanitize → evaluate → guarded update + audit → notify → repeat
 * </pre>
 *
 * <p>Each tick is a fresh {@link Mono} pipeline whose terminal {@code subscribe()}
 * schedules the next tick. The loop never stops: a failed tick is logged and the next
 * one is scheduled on the regular interval. Within a tick, a failure while checking one
 * signal is logged and counted and never affects the others.
 *
 * <p>No lock is held across the feed call. Correctness under concurrent writers (a
 * second watcher, an operator cancel) rests entirely on the store's conditional update.
 */
@Component
public class SignalLifecycleWatcher {

    private static final Logger log = LoggerFactory.getLogger(SignalLifecycleWatcher.class);

    private final SignalStore store;
    private final CandleFeed feed;
    private final SignalNotificationPublisher publisher;
    private final LifecycleEvaluator evaluator;
    private final WatcherHeartbeat heartbeat;
    private final WatcherSettings settings;
    private final Clock clock;

    public SignalLifecycleWatcher(SignalStore store, CandleFeed feed, SignalNotificationPublisher publisher,
                                  LifecycleEvaluator evaluator, WatcherHeartbeat heartbeat,
                                  WatcherSettings settings, Clock clock) {
        this.store     = store;
        this.feed      = feed;
        this.publisher = publisher;
        this.evaluator = evaluator;
        this.heartbeat = heartbeat;
        this.settings  = settings;
        this.clock     = clock;
    }

    @PostConstruct
    public void start() {
        if (!settings.enabled()) {
            log.warn("Signal lifecycle watcher DISABLED (watcher.enabled=false)");
            return;
        }
        log.info("Signal lifecycle watcher started. pollInterval={}s staleAfter={}m lookback={} concurrency={}",
                 settings.pollInterval().toSeconds(), evaluator.staleAfter().toMinutes(),
                 settings.lookback(), settings.concurrency());
        scheduleNextTick(settings.pollInterval());
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextTick(Duration delay) {
        Mono.delay(delay)
            .then(Mono.defer(() -> runTick(clock.instant())))
            .subscribe(
                report -> scheduleNextTick(settings.pollInterval()),
                err -> {
                    log.error("WATCHER_TICK_FAILED rescheduling in {}s", settings.pollInterval().toSeconds(), err);
                    scheduleNextTick(settings.pollInterval());
                }
            );
    }

    // ── one tick ──────────────────────────────────────────────────────────────

    /**
     * Runs a single pass over all non-terminal signals as of {@code now}. Candle
     * fetches are shared between signals of the same asset and timeframe.
     */
    public Mono<TickReport> runTick(Instant now) {
        String traceId = TraceContextUtil.newTraceId("tick");
        Map<String, Mono<List<Candle>>> candleCache = new ConcurrentHashMap<>();

        Mono<TickReport> tick = store.findNonTerminal()
            .flatMap(signal -> checkSignal(signal, now, traceId, candleCache), settings.concurrency())
            .collectList()
            .map(checks -> TickReport.of(traceId, now, checks))
            .doOnNext(heartbeat::recordTick)
            .doOnEach(s -> {
                if (s.isOnNext()) {
                    TickReport r = s.get();
                    TraceContextUtil.withMdc(TraceContextUtil.getTraceId(s.getContextView()), () ->
                        log.info("WATCHER_TICK checked={} transitioned={} reclaimed={} failed={} malformedCandles={} feedFailures={} feeds={}",
                                 r.checked(), r.transitioned(), r.reclaimed(), r.failed(), r.malformedCandles(),
                                 r.feedFailures(), candleCache.size()));
                }
            });
        return TraceContextUtil.withTraceId(tick, traceId);
    }

    private Mono<SignalCheck> checkSignal(Signal signal, Instant now, String traceId,
                                          Map<String, Mono<List<Candle>>> candleCache) {
        long id = signal.id();
        Mono<List<Candle>> candles = candleCache.computeIfAbsent(signal.asset() + "|" + signal.timeframe(),
            key -> feed.fetchCandles(signal.asset(), signal.timeframe(), settings.lookback())
                       .defaultIfEmpty(List.of())
                       .cache());

        return candles
            .map(raw -> {
                CandleValidator.Sanitized sanitized = CandleValidator.sanitize(raw);
                if (sanitized.hasRejected()) {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("MALFORMED_CANDLES_SKIPPED id={} asset={} count={}",
                                 id, signal.asset(), sanitized.rejected().size()));
                }
                return new Evaluation(evaluator.evaluate(signal, sanitized.valid(), now),
                                      sanitized.rejected().size(), true);
            })
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("FEED_UNAVAILABLE id={} asset={} timeframe={} reason={} (zombie check only)",
                             id, signal.asset(), signal.timeframe(), e.getMessage()));
                return Mono.just(new Evaluation(evaluator.reclaimIfStale(signal, now), 0, false));
            })
            .flatMap(evaluation -> apply(signal, evaluation, now, traceId))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("SIGNAL_CHECK_FAILED id={} state={}", id, signal.state(), e));
                return Mono.just(SignalCheck.failed(id));
            });
    }

    private Mono<SignalCheck> apply(Signal signal, Evaluation evaluation, Instant now, String traceId) {
        long id = signal.id();
        if (evaluation.transition().isEmpty()) {
            return Mono.just(new SignalCheck(id, SignalCheck.Outcome.UNCHANGED, evaluation.malformed(),
                                             evaluation.marketData()));
        }
        SignalTransition t = evaluation.transition().get();
        boolean zombie = t.cause() == TransitionCause.ADMINISTRATIVE;

        return store.applyTransition(t, now)
            .map(applied -> {
                if (!applied) {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.info("TRANSITION_GUARD_LOST id={} expected={} target={}", id, t.expectedState(), t.newState()));
                    return new SignalCheck(id, SignalCheck.Outcome.GUARD_LOST, evaluation.malformed(),
                                           evaluation.marketData());
                }
                TraceContextUtil.withMdc(traceId, () -> {
                    if (zombie) {
                        log.warn("ZOMBIE_RECLAIMED id={} asset={} from={} lastActivity={} reason={}",
                                 id, signal.asset(), t.expectedState(), signal.lastActivityAt(), t.reason());
                    } else {
                        log.info("SIGNAL_TRANSITION id={} asset={} from={} to={} cause={} candleTime={}",
                                 id, signal.asset(), t.expectedState(), t.newState(), t.cause(),
                                 t.evidence() == null ? null : t.evidence().timestamp());
                    }
                });
                if (t.isTerminal()) {
                    publisher.publish(SignalNotification.of(signal, t.newState()));
                }
                return new SignalCheck(id, zombie ? SignalCheck.Outcome.RECLAIMED : SignalCheck.Outcome.TRANSITIONED,
                                       evaluation.malformed(), evaluation.marketData());
            });
    }

    private record Evaluation(Optional<SignalTransition> transition, int malformed, boolean marketData) {}
}
