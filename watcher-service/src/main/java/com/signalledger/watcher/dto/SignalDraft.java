package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.common.model.SignalDirection;

/** A generated signal proposed for release. */
public record SignalDraft(
    @JsonProperty("asset")         String asset,
    @JsonProperty("timeframe")     String timeframe,
    @JsonProperty("direction")     SignalDirection direction,
    @JsonProperty("entryPrice")    double entryPrice,
    @JsonProperty("tp")            double tp,
    @JsonProperty("sl")            double sl,
    @JsonProperty("rawConfidence") double rawConfidence
) {}
