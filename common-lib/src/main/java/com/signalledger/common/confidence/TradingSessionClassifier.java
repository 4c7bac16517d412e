package com.signalledger.common.confidence;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Pure stateless classifier: maps an {@link Instant} to a {@link TradingSession}
 * and flags the daily rollover band.
 *
 * <p>All boundaries are UTC and half-open ({@code [start, end)}).
 * <pre>
 *   LONDON            06:00 – 13:00
 *   LONDON_NY_OVERLAP 13:00 – 17:00
 *   OFF_SESSION       17:00 – 06:00 (next day)
 *   rollover          21:00 – 24:00  (wide spreads)
 * </pre>
 */
public final class TradingSessionClassifier {

    private static final LocalTime LONDON_START   = LocalTime.of(6,  0);
    private static final LocalTime OVERLAP_START  = LocalTime.of(13, 0);
    private static final LocalTime OVERLAP_END    = LocalTime.of(17, 0);
    private static final LocalTime ROLLOVER_START = LocalTime.of(21, 0);

    private TradingSessionClassifier() {}

    /**
     * @param now any instant; only its UTC time of day matters
     * @return the session, never null
     */
    public static TradingSession classify(Instant now) {
        LocalTime time = now.atZone(ZoneOffset.UTC).toLocalTime();
        if (time.isBefore(LONDON_START))  return TradingSession.OFF_SESSION;
        if (time.isBefore(OVERLAP_START)) return TradingSession.LONDON;
        if (time.isBefore(OVERLAP_END))   return TradingSession.LONDON_NY_OVERLAP;
        return TradingSession.OFF_SESSION;
    }

    /** {@code true} from 21:00 UTC until midnight. */
    public static boolean isRollover(Instant now) {
        LocalTime time = now.atZone(ZoneOffset.UTC).toLocalTime();
        return !time.isBefore(ROLLOVER_START);
    }
}
