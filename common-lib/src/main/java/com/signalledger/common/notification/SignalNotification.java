package com.signalledger.common.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalDirection;
import com.signalledger.common.model.SignalState;

/** Outbound message sent when a signal is released and when it reaches a terminal state. */
public record SignalNotification(
    @JsonProperty("signalId")          long signalId,
    @JsonProperty("asset")             String asset,
    @JsonProperty("direction")         SignalDirection direction,
    @JsonProperty("entryPrice")        double entryPrice,
    @JsonProperty("tp")                double tp,
    @JsonProperty("sl")                double sl,
    @JsonProperty("releaseConfidence") Double releaseConfidence,
    @JsonProperty("newState")          SignalState newState
) {
    public static SignalNotification of(Signal signal, SignalState newState) {
        return new SignalNotification(signal.id(), signal.asset(), signal.direction(), signal.entryPrice(),
                                      signal.tp(), signal.sl(), signal.releaseConfidence(), newState);
    }
}
