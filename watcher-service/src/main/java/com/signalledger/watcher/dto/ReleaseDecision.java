package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.common.confidence.ReleaseScore;
import com.signalledger.common.model.Signal;

/**
 * Outcome of the release gate. {@code signal} is absent when the draft was rejected,
 * in which case nothing was persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReleaseDecision(
    @JsonProperty("released")  boolean released,
    @JsonProperty("score")     ReleaseScore score,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("signal")    Signal signal,
    @JsonProperty("reason")    String reason
) {
    public static ReleaseDecision rejected(ReleaseScore score, double threshold) {
        return new ReleaseDecision(false, score, threshold, null,
            "release score " + score.score() + " below threshold " + threshold);
    }
}
