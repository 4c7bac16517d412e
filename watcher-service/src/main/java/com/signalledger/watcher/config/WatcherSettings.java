package com.signalledger.watcher.config;

import java.time.Duration;

/**
 * Runtime knobs of the watcher service, assembled once from {@code application.yml}
 * by {@link WatcherConfig}.
 *
 * @param enabled          starts the polling loop on boot
 * @param pollInterval     delay between two ticks
 * @param entryWindow      how long a released signal may wait for its entry price
 * @param staleAfter       inactivity after which a non-terminal signal is reclaimed
 * @param stalledAfter     no successful tick for this long marks the watcher unhealthy
 * @param lookback         candles fetched per (asset, timeframe) each tick
 * @param timeframe        default timeframe for analysis and backfill
 * @param concurrency      signals checked in parallel within one tick
 * @param publishThreshold minimum release score for publication
 * @param backfillLookback candles fetched per timeframe by the outcome backfill
 */
public record WatcherSettings(
    boolean enabled,
    Duration pollInterval,
    Duration entryWindow,
    Duration staleAfter,
    Duration stalledAfter,
    int lookback,
    String timeframe,
    int concurrency,
    double publishThreshold,
    int backfillLookback
) {
    public WatcherSettings {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("watcher.poll-interval must be positive");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("watcher.concurrency must be >= 1");
        }
        if (publishThreshold < 0.0 || publishThreshold > 1.0) {
            throw new IllegalArgumentException("watcher.publish-threshold must be in [0, 1]");
        }
    }
}
