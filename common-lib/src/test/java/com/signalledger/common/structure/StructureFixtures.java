package com.signalledger.common.structure;

import com.signalledger.common.model.Candle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic candle series with known swing geometry.
 *
 * <p>Every candle has a body of one unit and wicks of 0.2 units on both sides, centred
 * on a "mid" value, so highs and lows rank exactly like the mids.
 */
final class StructureFixtures {

    static final Instant START = Instant.parse("2026-03-02T08:00:00Z");
    static final double  UNIT  = 0.001;

    private StructureFixtures() {}

    /**
     * Rising staircase: per cycle of six candles the mid goes +0, +2, +4, +6, +5, +4
     * above {@code 6k}. Swing highs at {@code 6k+3}, swing lows at {@code 6k+5}; every
     * swing high is broken with an accepted close at {@code 6k+7}.
     */
    static List<Candle> staircase(int size, boolean up) {
        int[] offsets = {0, 2, 4, 6, 5, 4};
        List<Double> mids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            mids.add((double) (6 * (i / 6) + offsets[i % 6]));
        }
        return fromMids(mids, up ? 1.1000 : 1.2000, up ? 1 : -1);
    }

    /** Mids 0, 2, 4, 2 repeated: equal highs and equal lows, nothing ever breaks. */
    static List<Candle> sideways(int size) {
        int[] offsets = {0, 2, 4, 2};
        List<Double> mids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            mids.add((double) offsets[i % 4]);
        }
        return fromMids(mids, 1.1000, 1);
    }

    static List<Candle> flat(int size) {
        List<Candle> candles = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            candles.add(Candle.of(START.plus(Duration.ofMinutes(5L * i)), 1.1, 1.1, 1.1, 1.1));
        }
        return candles;
    }

    private static List<Candle> fromMids(List<Double> mids, double base, int sign) {
        List<Candle> candles = new ArrayList<>(mids.size());
        for (int i = 0; i < mids.size(); i++) {
            double mid = mids.get(i);
            boolean rising = i == 0 || mid > mids.get(i - 1);
            double open  = mid + (rising ? -0.5 : 0.5);
            double close = mid + (rising ? 0.5 : -0.5);
            double high  = Math.max(open, close) + 0.2;
            double low   = Math.min(open, close) - 0.2;
            candles.add(sign > 0
                ? Candle.of(START.plus(Duration.ofMinutes(5L * i)),
                            price(base, open), price(base, high), price(base, low), price(base, close))
                : Candle.of(START.plus(Duration.ofMinutes(5L * i)),
                            price(base, -open), price(base, -low), price(base, -high), price(base, -close)));
        }
        return candles;
    }

    private static double price(double base, double units) {
        return base + units * UNIT;
    }
}
