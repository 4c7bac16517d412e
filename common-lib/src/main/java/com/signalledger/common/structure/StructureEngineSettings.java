package com.signalledger.common.structure;

/**
 * Tunables of the {@link StructureStateEngine}.
 *
 * @param sensitivity     swing radius in candles on each side
 * @param minWindow       shortest window accepted by {@code analyze}
 * @param breakThreshold  fractional distance beyond a swing that counts as a break
 * @param dominanceWindow trailing closes used for the dominance ratio
 * @param minTotalScore   combined directional score below which the state is ranging
 * @param leadRatio       factor by which one side must outscore the other
 * @param maxConfidence   confidence cap; the engine never claims certainty
 */
public record StructureEngineSettings(
    int sensitivity,
    int minWindow,
    double breakThreshold,
    int dominanceWindow,
    double minTotalScore,
    double leadRatio,
    double maxConfidence
) {
    public StructureEngineSettings {
        if (sensitivity < 1) throw new IllegalArgumentException("sensitivity must be >= 1");
        if (minWindow < 2 * sensitivity + 1) {
            throw new IllegalArgumentException("minWindow must fit at least one swing: " + minWindow);
        }
        if (dominanceWindow < 1) throw new IllegalArgumentException("dominanceWindow must be >= 1");
        if (maxConfidence <= 0 || maxConfidence > 1) {
            throw new IllegalArgumentException("maxConfidence must be in (0, 1]");
        }
    }

    public static StructureEngineSettings defaults() {
        return new StructureEngineSettings(2, 30, 0.0001, 20, 0.3, 1.2, 0.98);
    }
}
