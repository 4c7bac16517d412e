package com.signalledger.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Publication score of a signal together with the factors that produced it.
 * {@code score} is in [0, 1].
 */
public record ReleaseScore(
    @JsonProperty("score")            double score,
    @JsonProperty("rawConfidence")    double rawConfidence,
    @JsonProperty("sessionWeight")    double sessionWeight,
    @JsonProperty("volatilityFactor") double volatilityFactor,
    @JsonProperty("spreadFactor")     double spreadFactor
) {

    @JsonProperty("explanation")
    public String explanation() {
        return String.format(Locale.ROOT, "raw=%.4f;session=%.2f;volatility=%.2f;spread=%.2f",
                             rawConfidence, sessionWeight, volatilityFactor, spreadFactor);
    }

    public boolean meets(double threshold) {
        return score >= threshold;
    }
}
