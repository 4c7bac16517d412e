package com.signalledger.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record tying one lifecycle transition to the candle that justified it.
 * Candle fields are {@code null} for transitions no candle caused (release with no
 * market data, administrative cancel).
 */
public record ValidationEvent(
    @JsonProperty("id")          Long id,
    @JsonProperty("signalId")    Long signalId,
    @JsonProperty("fromState")   SignalState fromState,
    @JsonProperty("toState")     SignalState toState,
    @JsonProperty("cause")       TransitionCause cause,
    @JsonProperty("reason")      String reason,
    @JsonProperty("candleTime")  Instant candleTime,
    @JsonProperty("candleOpen")  Double candleOpen,
    @JsonProperty("candleHigh")  Double candleHigh,
    @JsonProperty("candleLow")   Double candleLow,
    @JsonProperty("candleClose") Double candleClose,
    @JsonProperty("recordedAt")  Instant recordedAt
) {}
