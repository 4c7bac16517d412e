package com.signalledger.common.structure;

import com.signalledger.common.model.Candle;

import java.util.List;

/**
 * Flags breaks that reverse right after they happen.
 *
 * <p>A break is fake when at least two of the following hold:
 * <ol>
 *   <li>the close did not accept the level (wick-only break)</li>
 *   <li>wicks cover more than 60% of the breaking candle's range</li>
 *   <li>the body is under 30% of the range</li>
 *   <li>fewer than half of the next two closes stay beyond the level</li>
 * </ol>
 * A break on the last candle of the window has no follow-through yet.
 */
public final class FakeBreakoutFilter {

    static final double WICK_DOMINANT_RATIO = 0.6;
    static final double WEAK_BODY_RATIO     = 0.3;
    static final int    FOLLOW_THROUGH_BARS = 2;
    static final int    FAKE_SCORE          = 2;

    public boolean isFake(StructureEvent event, List<Candle> candles) {
        Candle candle = candles.get(event.candleIndex());
        int score = 0;
        if (!event.closeAcceptance())                    score++;
        if (isWickDominant(candle))                      score++;
        if (event.bodyStrength() < WEAK_BODY_RATIO)      score++;
        if (!hasFollowThrough(event, candles))           score++;
        return score >= FAKE_SCORE;
    }

    static boolean isWickDominant(Candle c) {
        double range = c.range();
        if (range == 0) return false;
        double upper = c.high() - Math.max(c.open(), c.close());
        double lower = Math.min(c.open(), c.close()) - c.low();
        return (upper + lower) / range > WICK_DOMINANT_RATIO;
    }

    static boolean hasFollowThrough(StructureEvent event, List<Candle> candles) {
        int start = event.candleIndex() + 1;
        int end   = Math.min(start + FOLLOW_THROUGH_BARS, candles.size());
        if (start >= end) return false;

        int beyond = 0;
        for (int i = start; i < end; i++) {
            double close = candles.get(i).close();
            boolean held = event.direction() == StructureDirection.BULLISH
                ? close > event.brokenLevel()
                : close < event.brokenLevel();
            if (held) beyond++;
        }
        return beyond * 2 >= end - start;
    }
}
