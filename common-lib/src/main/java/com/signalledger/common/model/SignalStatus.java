package com.signalledger.common.model;

/**
 * Coarse operational bucket. Always derived from {@link SignalState} via
 * {@link #forState(SignalState)} so that state and status never disagree
 * about terminality.
 */
public enum SignalStatus {
    ACTIVE,
    CLOSED,
    EXPIRED;

    public static SignalStatus forState(SignalState state) {
        return switch (state) {
            case CANDIDATE, WAITING_FOR_ENTRY, ENTRY_HIT -> ACTIVE;
            case EXPIRED                                 -> EXPIRED;
            case TP_HIT, SL_HIT, CANCELLED               -> CLOSED;
        };
    }
}
