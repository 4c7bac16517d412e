package com.signalledger.common.confidence;

/**
 * Liquidity session of the global FX day, classified on UTC hours.
 *
 * <ul>
 *   <li>{@link #LONDON_NY_OVERLAP}: 13:00 to 17:00 UTC, deepest liquidity</li>
 *   <li>{@link #LONDON}: 06:00 to 13:00 UTC</li>
 *   <li>{@link #OFF_SESSION}: everything else, including the Asian session</li>
 * </ul>
 */
public enum TradingSession {
    LONDON_NY_OVERLAP,
    LONDON,
    OFF_SESSION
}
