package com.signalledger.common.validation;

import com.signalledger.common.exception.MalformedCandleException;
import com.signalledger.common.model.Candle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Candle sanity checks shared by the structure engine, the lifecycle watcher and
 * the backfill so that all three see the same data.
 */
public final class CandleValidator {

    private CandleValidator() {}

    /**
     * Strict check for analysis windows: every candle consistent, timestamps strictly
     * increasing (no duplicates).
     *
     * @throws MalformedCandleException on the first offending candle
     */
    public static void requireValidSeries(List<Candle> candles) {
        Candle previous = null;
        for (Candle c : candles) {
            if (c == null || !c.isConsistent()) {
                throw new MalformedCandleException(c, "inconsistent OHLC candle: " + c);
            }
            if (previous != null && !c.timestamp().isAfter(previous.timestamp())) {
                throw new MalformedCandleException(c, "candle at " + c.timestamp()
                    + " is not after previous candle at " + previous.timestamp());
            }
            previous = c;
        }
    }

    /**
     * Lenient pass used per signal by the watcher: drops inconsistent candles and
     * candles that do not advance time, keeping the rest in order.
     */
    public static Sanitized sanitize(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return new Sanitized(List.of(), List.of());
        }
        List<Candle> valid = new ArrayList<>(candles.size());
        List<Candle> rejected = new ArrayList<>();
        Candle previous = null;
        for (Candle c : candles) {
            boolean ordered = c != null && c.timestamp() != null
                && (previous == null || c.timestamp().isAfter(previous.timestamp()));
            if (c != null && c.isConsistent() && ordered) {
                valid.add(c);
                previous = c;
            } else {
                rejected.add(c);
            }
        }
        return new Sanitized(Collections.unmodifiableList(valid), Collections.unmodifiableList(rejected));
    }

    public record Sanitized(List<Candle> valid, List<Candle> rejected) {
        public boolean hasRejected() {
            return !rejected.isEmpty();
        }
    }
}
