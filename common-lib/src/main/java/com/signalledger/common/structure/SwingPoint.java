package com.signalledger.common.structure;

/**
 * A confirmed local pivot.
 *
 * @param index    candle index within the analysed window
 * @param price    the pivot high or low
 * @param type     HIGH or LOW
 * @param strength confirming candles on each side (at least the detector sensitivity)
 */
public record SwingPoint(int index, double price, SwingType type, int strength) {

    public enum SwingType { HIGH, LOW }

    public boolean isHigh() {
        return type == SwingType.HIGH;
    }
}
