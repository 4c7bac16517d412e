package com.signalledger.common.structure;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Output of {@link StructureStateEngine#analyze}. Produced fresh on every call and
 * never mutated; {@code evidence} is unmodifiable.
 */
public record StructureState(
    @JsonProperty("direction")      StructureDirection direction,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("dominanceRatio") double dominanceRatio,
    @JsonProperty("evidence")       List<EvidenceItem> evidence,
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("timeframe")      String timeframe,
    @JsonProperty("source")         String source,
    @JsonProperty("generatedAt")    Instant generatedAt
) {
    public StructureState {
        evidence = List.copyOf(evidence);
    }
}
