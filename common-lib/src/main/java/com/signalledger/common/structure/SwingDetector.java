package com.signalledger.common.structure;

import com.signalledger.common.model.Candle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic pivot detection with a fixed look-back / look-forward radius.
 *
 * <p>Swing high at {@code i}: {@code high[i]} strictly above the {@code n} highs on
 * each side. Swing low mirrored on lows. A larger sensitivity yields fewer, more
 * significant swings. Edges (first and last {@code n} candles) never qualify.
 */
public final class SwingDetector {

    private static final int MAX_STRENGTH_REACH = 10;

    private final int sensitivity;

    public SwingDetector(int sensitivity) {
        if (sensitivity < 1) {
            throw new IllegalArgumentException("sensitivity must be >= 1, got " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    public int sensitivity() {
        return sensitivity;
    }

    /** All swings ordered by index; a HIGH precedes a LOW on the same candle. */
    public List<SwingPoint> detect(List<Candle> candles) {
        List<SwingPoint> swings = new ArrayList<>();
        int n = sensitivity;
        for (int i = n; i < candles.size() - n; i++) {
            if (isPivot(candles, i, true)) {
                swings.add(new SwingPoint(i, candles.get(i).high(), SwingPoint.SwingType.HIGH,
                                          strength(candles, i, true)));
            }
            if (isPivot(candles, i, false)) {
                swings.add(new SwingPoint(i, candles.get(i).low(), SwingPoint.SwingType.LOW,
                                          strength(candles, i, false)));
            }
        }
        swings.sort(Comparator.comparingInt(SwingPoint::index)
                              .thenComparing(SwingPoint::type));
        return swings;
    }

    private boolean isPivot(List<Candle> candles, int i, boolean high) {
        double pivot = price(candles.get(i), high);
        for (int j = 1; j <= sensitivity; j++) {
            if (!beats(pivot, price(candles.get(i - j), high), high)
                    || !beats(pivot, price(candles.get(i + j), high), high)) {
                return false;
            }
        }
        return true;
    }

    /** Sensitivity plus the run of further bars (both sides) the pivot still dominates. */
    private int strength(List<Candle> candles, int i, boolean high) {
        double pivot = price(candles.get(i), high);
        int reach = Math.min(MAX_STRENGTH_REACH, Math.min(i, candles.size() - 1 - i));
        int strength = sensitivity;
        for (int offset = sensitivity + 1; offset <= reach; offset++) {
            if (beats(pivot, price(candles.get(i - offset), high), high)
                    && beats(pivot, price(candles.get(i + offset), high), high)) {
                strength++;
            } else {
                break;
            }
        }
        return strength;
    }

    private static double price(Candle c, boolean high) {
        return high ? c.high() : c.low();
    }

    private static boolean beats(double pivot, double other, boolean high) {
        return high ? pivot > other : pivot < other;
    }
}
