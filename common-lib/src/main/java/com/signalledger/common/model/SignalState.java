package com.signalledger.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle progress of a {@link Signal}.
 *
 * <pre>
 *   CANDIDATE → WAITING_FOR_ENTRY → ENTRY_HIT → TP_HIT | SL_HIT
 *                        └→ EXPIRED
 *   any non-terminal  → CANCELLED   (administrative / zombie reclamation)
 * </pre>
 *
 * Transitions only ever move forward; terminal states have no outgoing edge.
 */
public enum SignalState {
    CANDIDATE,
    WAITING_FOR_ENTRY,
    ENTRY_HIT,
    TP_HIT,
    SL_HIT,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this == TP_HIT || this == SL_HIT || this == EXPIRED || this == CANCELLED;
    }

    public boolean canTransitionTo(SignalState next) {
        return allowedNext().contains(next);
    }

    public Set<SignalState> allowedNext() {
        return switch (this) {
            case CANDIDATE         -> EnumSet.of(WAITING_FOR_ENTRY, CANCELLED);
            case WAITING_FOR_ENTRY -> EnumSet.of(ENTRY_HIT, EXPIRED, CANCELLED);
            case ENTRY_HIT         -> EnumSet.of(TP_HIT, SL_HIT, CANCELLED);
            case TP_HIT, SL_HIT, EXPIRED, CANCELLED -> EnumSet.noneOf(SignalState.class);
        };
    }

    public static Set<SignalState> nonTerminal() {
        return EnumSet.of(CANDIDATE, WAITING_FOR_ENTRY, ENTRY_HIT);
    }
}
