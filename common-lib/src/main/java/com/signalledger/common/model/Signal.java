package com.signalledger.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of a persisted trading signal.
 *
 * <p>The signal row itself is the mutable aggregate root, but it only ever changes
 * through a conditional {@link com.signalledger.common.lifecycle.SignalTransition}
 * applied by a {@link com.signalledger.common.store.SignalStore}. Entry, take-profit
 * and stop-loss never change after creation.
 */
public record Signal(
    @JsonProperty("id")                Long id,
    @JsonProperty("asset")             String asset,
    @JsonProperty("timeframe")         String timeframe,
    @JsonProperty("direction")         SignalDirection direction,
    @JsonProperty("entryPrice")        double entryPrice,
    @JsonProperty("tp")                double tp,
    @JsonProperty("sl")                double sl,
    @JsonProperty("rewardRiskRatio")   double rewardRiskRatio,
    @JsonProperty("rawConfidence")     double rawConfidence,
    @JsonProperty("releaseConfidence") Double releaseConfidence,
    @JsonProperty("state")             SignalState state,
    @JsonProperty("status")            SignalStatus status,
    @JsonProperty("result")            SignalResult result,
    @JsonProperty("generatedAt")       Instant generatedAt,
    @JsonProperty("expiresAt")         Instant expiresAt,
    @JsonProperty("entryHitAt")        Instant entryHitAt,
    @JsonProperty("closedAt")          Instant closedAt,
    @JsonProperty("acknowledgedAt")    Instant acknowledgedAt,
    @JsonProperty("released")          boolean released
) {

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Most recent moment anything happened to this signal; drives zombie reclamation. */
    public Instant lastActivityAt() {
        Instant last = generatedAt;
        if (entryHitAt != null && entryHitAt.isAfter(last))         last = entryHitAt;
        if (acknowledgedAt != null && acknowledgedAt.isAfter(last)) last = acknowledgedAt;
        return last;
    }

    public Signal withId(Long newId) {
        return new Signal(newId, asset, timeframe, direction, entryPrice, tp, sl, rewardRiskRatio,
                          rawConfidence, releaseConfidence, state, status, result, generatedAt,
                          expiresAt, entryHitAt, closedAt, acknowledgedAt, released);
    }

    public Signal withAcknowledgedAt(Instant at) {
        return new Signal(id, asset, timeframe, direction, entryPrice, tp, sl, rewardRiskRatio,
                          rawConfidence, releaseConfidence, state, status, result, generatedAt,
                          expiresAt, entryHitAt, closedAt, at, released);
    }
}
