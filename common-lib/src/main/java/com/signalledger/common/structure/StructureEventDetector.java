package com.signalledger.common.structure;

import com.signalledger.common.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the window chronologically and emits a {@link StructureEvent} whenever the
 * most recent confirmed swing high or low is broken.
 *
 * <p>A swing becomes breakable only once it is confirmed, i.e. {@code sensitivity}
 * candles after its index, so the detector never uses information from the future.
 * Each swing is broken at most once. Only close-accepted breaks move the
 * prevailing trend; the first break of the window (no trend yet) counts as BOS.
 */
public final class StructureEventDetector {

    private final int sensitivity;
    private final double breakThreshold;

    public StructureEventDetector(int sensitivity, double breakThreshold) {
        this.sensitivity    = sensitivity;
        this.breakThreshold = breakThreshold;
    }

    public List<StructureEvent> detect(List<Candle> candles, List<SwingPoint> swings) {
        List<StructureEvent> events = new ArrayList<>();
        StructureDirection trend = StructureDirection.RANGING;
        SwingPoint activeHigh = null;
        SwingPoint activeLow  = null;
        int next = 0;

        for (int i = 0; i < candles.size(); i++) {
            while (next < swings.size() && swings.get(next).index() + sensitivity < i) {
                SwingPoint s = swings.get(next++);
                if (s.isHigh()) activeHigh = s;
                else            activeLow  = s;
            }

            Candle c = candles.get(i);
            double body = c.range() > 0 ? c.body() / c.range() : 0.0;

            if (activeHigh != null) {
                double trigger = activeHigh.price() * (1 + breakThreshold);
                boolean accepted = c.close() > trigger;
                if (accepted || c.high() > trigger) {
                    events.add(new StructureEvent(classify(trend, StructureDirection.BULLISH),
                        StructureDirection.BULLISH, activeHigh.price(), i, body, accepted));
                    if (accepted) trend = StructureDirection.BULLISH;
                    activeHigh = null;
                }
            }
            if (activeLow != null) {
                double trigger = activeLow.price() * (1 - breakThreshold);
                boolean accepted = c.close() < trigger;
                if (accepted || c.low() < trigger) {
                    events.add(new StructureEvent(classify(trend, StructureDirection.BEARISH),
                        StructureDirection.BEARISH, activeLow.price(), i, body, accepted));
                    if (accepted) trend = StructureDirection.BEARISH;
                    activeLow = null;
                }
            }
        }
        return events;
    }

    private static StructureEvent.Type classify(StructureDirection trend, StructureDirection breakDirection) {
        return trend == breakDirection.opposite() ? StructureEvent.Type.CHOCH : StructureEvent.Type.BOS;
    }
}
