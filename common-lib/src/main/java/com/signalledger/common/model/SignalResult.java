package com.signalledger.common.model;

public enum SignalResult {
    PROFIT,
    LOSS,
    EXPIRED,
    CANCELLED;

    /** Result recorded alongside a terminal state; {@code null} for non-terminal states. */
    public static SignalResult forState(SignalState state) {
        return switch (state) {
            case TP_HIT    -> PROFIT;
            case SL_HIT    -> LOSS;
            case EXPIRED   -> EXPIRED;
            case CANCELLED -> CANCELLED;
            default        -> null;
        };
    }
}
