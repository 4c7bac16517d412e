package com.signalledger.common.structure;

/**
 * A break of a confirmed swing.
 *
 * @param type            BOS (with the prevailing structure) or CHOCH (against it)
 * @param direction       BULLISH when a swing high was broken, BEARISH for a swing low
 * @param brokenLevel     the swing price that was broken
 * @param candleIndex     index of the breaking candle
 * @param bodyStrength    body / range of the breaking candle, 0..1
 * @param closeAcceptance close beyond the level (as opposed to a wick-only break)
 */
public record StructureEvent(
    Type type,
    StructureDirection direction,
    double brokenLevel,
    int candleIndex,
    double bodyStrength,
    boolean closeAcceptance
) {
    public enum Type { BOS, CHOCH }
}
