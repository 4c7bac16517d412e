package com.signalledger.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One OHLCV candle as emitted by a {@link com.signalledger.common.feed.CandleFeed}.
 * {@code timestamp} is the candle open time (UTC). Volume may be zero for OTC markets.
 */
public record Candle(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("open")      double open,
    @JsonProperty("high")      double high,
    @JsonProperty("low")       double low,
    @JsonProperty("close")     double close,
    @JsonProperty("volume")    double volume
) {
    public static Candle of(Instant timestamp, double open, double high, double low, double close) {
        return new Candle(timestamp, open, high, low, close, 0.0);
    }

    /** {@code low <= min(open, close)} and {@code high >= max(open, close)}, all prices finite and positive. */
    public boolean isConsistent() {
        if (timestamp == null) return false;
        if (!positive(open) || !positive(high) || !positive(low) || !positive(close)) return false;
        if (!Double.isFinite(volume) || volume < 0) return false;
        return low <= Math.min(open, close) && high >= Math.max(open, close);
    }

    public double range() {
        return high - low;
    }

    public double body() {
        return Math.abs(close - open);
    }

    private static boolean positive(double v) {
        return Double.isFinite(v) && v > 0;
    }
}
