package com.signalledger.common.lifecycle;

import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalDirection;
import com.signalledger.common.outcome.OutcomeResolver;
import com.signalledger.common.outcome.Resolution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure lifecycle rules: given a signal, the candles seen so far and the current time,
 * decides the single next transition (if any).
 *
 * <p>Order of evaluation, first match wins:
 * <ol>
 *   <li>terminal signals never move</li>
 *   <li>market: entry touch, or take-profit / stop-loss from the entry candle on</li>
 *   <li>expiry: entry window closed without a touch</li>
 *   <li>zombie reclamation: no activity for {@code staleAfter}</li>
 * </ol>
 *
 * <p>Holds no state between calls; evaluating the same input twice gives the same answer.
 */
public final class LifecycleEvaluator {

    private final Duration staleAfter;
    private final OutcomeResolver resolver;

    public LifecycleEvaluator(Duration staleAfter, OutcomeResolver resolver) {
        if (staleAfter == null || staleAfter.isNegative() || staleAfter.isZero()) {
            throw new IllegalArgumentException("staleAfter must be positive: " + staleAfter);
        }
        this.staleAfter = staleAfter;
        this.resolver   = Objects.requireNonNull(resolver, "resolver");
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    /**
     * @param candles sanitized candles, oldest first
     */
    public Optional<SignalTransition> evaluate(Signal signal, List<Candle> candles, Instant now) {
        if (signal.isTerminal()) {
            return Optional.empty();
        }
        Optional<SignalTransition> market = switch (signal.state()) {
            case WAITING_FOR_ENTRY -> waitingForEntry(signal, candles, now);
            case ENTRY_HIT         -> entered(signal, candles);
            default                -> Optional.empty();
        };
        return market.isPresent() ? market : reclaimIfStale(signal, now);
    }

    /** Zombie check alone; used when no market data could be obtained. */
    public Optional<SignalTransition> reclaimIfStale(Signal signal, Instant now) {
        if (signal.isTerminal() || !isStale(signal, now)) {
            return Optional.empty();
        }
        Duration age = Duration.between(signal.lastActivityAt(), now);
        return Optional.of(SignalTransition.cancel(signal, now,
            "zombie reclaimed: no activity for " + age.toMinutes() + "m (threshold "
            + staleAfter.toMinutes() + "m) in state " + signal.state()));
    }

    /** At least {@code staleAfter} since the signal's last recorded activity. */
    public boolean isStale(Signal signal, Instant now) {
        Duration age = Duration.between(signal.lastActivityAt(), now);
        return age.compareTo(staleAfter) >= 0;
    }

    private Optional<SignalTransition> waitingForEntry(Signal signal, List<Candle> candles, Instant now) {
        for (Candle c : candles) {
            Instant t = c.timestamp();
            if (t.isBefore(signal.generatedAt()) || !t.isBefore(signal.expiresAt())) {
                continue;
            }
            if (touchesEntry(signal, c)) {
                return Optional.of(SignalTransition.entryHit(signal, c));
            }
        }
        if (!now.isBefore(signal.expiresAt())) {
            return Optional.of(SignalTransition.expire(signal, now));
        }
        return Optional.empty();
    }

    private Optional<SignalTransition> entered(Signal signal, List<Candle> candles) {
        Resolution resolution = resolver.resolveFromEntry(signal, candles);
        return switch (resolution.outcome()) {
            case HIT_SL  -> Optional.of(SignalTransition.stopLoss(signal, resolution.trigger()));
            case HIT_TP  -> Optional.of(SignalTransition.takeProfit(signal, resolution.trigger()));
            case EXPIRED -> Optional.empty();
        };
    }

    static boolean touchesEntry(Signal signal, Candle c) {
        return signal.direction() == SignalDirection.BUY
            ? c.low() <= signal.entryPrice()
            : c.high() >= signal.entryPrice();
    }
}
