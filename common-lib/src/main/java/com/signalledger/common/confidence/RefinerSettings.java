package com.signalledger.common.confidence;

/**
 * Weights and penalties of the {@link ConfidenceRefiner}.
 *
 * @param overlapWeight        session weight during the London/New York overlap
 * @param londonWeight         session weight during London
 * @param offSessionWeight     session weight otherwise
 * @param volatilityLookback   number of candles in the true-range baseline
 * @param lowVolatilityRatio   last range / baseline below which the market is dead
 * @param highVolatilityRatio  last range / baseline above which the market is erratic
 * @param lowVolatilityFactor  multiplier applied to a dead market
 * @param highVolatilityFactor multiplier applied to an erratic market
 * @param rolloverSpreadFactor multiplier applied inside the rollover band
 */
public record RefinerSettings(
    double overlapWeight,
    double londonWeight,
    double offSessionWeight,
    int volatilityLookback,
    double lowVolatilityRatio,
    double highVolatilityRatio,
    double lowVolatilityFactor,
    double highVolatilityFactor,
    double rolloverSpreadFactor
) {
    public RefinerSettings {
        if (volatilityLookback < 1) {
            throw new IllegalArgumentException("volatilityLookback must be >= 1");
        }
        if (lowVolatilityRatio >= highVolatilityRatio) {
            throw new IllegalArgumentException("lowVolatilityRatio must be below highVolatilityRatio");
        }
    }

    public static RefinerSettings defaults() {
        return new RefinerSettings(1.2, 1.0, 0.8, 14, 0.5, 2.5, 0.7, 0.6, 0.5);
    }
}
