package com.signalledger.watcher.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one watcher tick.
 *
 * @param checked          non-terminal signals examined
 * @param transitioned     market or expiry transitions applied
 * @param reclaimed        zombie reclamations applied
 * @param failed           signals whose check failed (logged, retried next tick)
 * @param malformedCandles candles skipped across all signals
 * @param feedFailures     signals checked without market data (zombie check only)
 */
public record TickReport(
    @JsonProperty("traceId")          String traceId,
    @JsonProperty("tickTime")         Instant tickTime,
    @JsonProperty("checked")          int checked,
    @JsonProperty("transitioned")     int transitioned,
    @JsonProperty("reclaimed")        int reclaimed,
    @JsonProperty("failed")           int failed,
    @JsonProperty("malformedCandles") int malformedCandles,
    @JsonProperty("feedFailures")     int feedFailures
) {
    static TickReport of(String traceId, Instant tickTime, List<SignalCheck> checks) {
        int transitioned = 0, reclaimed = 0, failed = 0, malformed = 0, feedFailures = 0;
        for (SignalCheck check : checks) {
            switch (check.outcome()) {
                case TRANSITIONED -> transitioned++;
                case RECLAIMED    -> reclaimed++;
                case FAILED       -> failed++;
                default           -> { }
            }
            malformed += check.malformedCandles();
            if (!check.marketData()) feedFailures++;
        }
        return new TickReport(traceId, tickTime, checks.size(), transitioned, reclaimed, failed, malformed,
                              feedFailures);
    }

    /** At least one signal saw candles, or there was nothing to check. */
    public boolean hadMarketData() {
        return checked == 0 || feedFailures < checked;
    }
}
