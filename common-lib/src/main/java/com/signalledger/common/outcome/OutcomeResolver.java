package com.signalledger.common.outcome;

import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;

import java.time.Instant;
import java.util.List;

/**
 * Replays candles against a signal's take-profit and stop-loss.
 *
 * <p>Candles are scanned in order and the first one touching a level decides.
 * When a single candle spans both levels the intra-candle path is unknown, so the
 * stop-loss wins:
 * <pre>
 *   BUY : low  &lt;= sl → HIT_SL, else high &gt;= tp → HIT_TP
 *   SELL: high &gt;= sl → HIT_SL, else low  &lt;= tp → HIT_TP
 * </pre>
 * Pure: no clock, no I/O. The lifecycle watcher and the backfill both use it so a
 * signal can never be judged two different ways.
 */
public final class OutcomeResolver {

    public Outcome resolve(Signal signal, List<Candle> candles) {
        return resolveDetailed(signal, candles).outcome();
    }

    public Resolution resolveDetailed(Signal signal, List<Candle> candles) {
        for (Candle c : candles) {
            Outcome hit = check(signal, c);
            if (hit != null) {
                return new Resolution(hit, c);
            }
        }
        return Resolution.expired();
    }

    /**
     * Replays the candles of an entered trade, starting at the candle that opened at
     * {@code entryHitAt} (falling back to {@code generatedAt}). Earlier candles are ignored.
     *
     * <p>The entry candle is replayed too, but it can only stop the trade out: its high
     * may have been printed before the fill, so a take-profit touch inside it is not
     * counted. From the next candle on the usual stop-loss-first rule applies.
     */
    public Resolution resolveFromEntry(Signal signal, List<Candle> candles) {
        Instant entryAt = signal.entryHitAt() != null ? signal.entryHitAt() : signal.generatedAt();
        for (Candle c : candles) {
            if (c.timestamp().isBefore(entryAt)) continue;
            Outcome hit = check(signal, c);
            if (hit == Outcome.HIT_TP && c.timestamp().equals(entryAt)) continue;
            if (hit != null) {
                return new Resolution(hit, c);
            }
        }
        return Resolution.expired();
    }

    /**
     * R-multiple of a resolved trade: {@code +rewardRiskRatio} on take-profit,
     * {@code -1} on stop-loss, {@code 0} otherwise.
     */
    public double computeRMultiple(Outcome outcome, Signal signal) {
        return switch (outcome) {
            case HIT_TP  -> signal.rewardRiskRatio();
            case HIT_SL  -> -1.0;
            case EXPIRED -> 0.0;
        };
    }

    static Outcome check(Signal signal, Candle c) {
        return switch (signal.direction()) {
            case BUY -> {
                if (c.low() <= signal.sl())  yield Outcome.HIT_SL;
                if (c.high() >= signal.tp()) yield Outcome.HIT_TP;
                yield null;
            }
            case SELL -> {
                if (c.high() >= signal.sl()) yield Outcome.HIT_SL;
                if (c.low() <= signal.tp())  yield Outcome.HIT_TP;
                yield null;
            }
        };
    }
}
