package com.signalledger.common.lifecycle;

import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalResult;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.SignalStatus;
import com.signalledger.common.model.TransitionCause;

import java.time.Instant;
import java.util.Objects;

/**
 * One guarded state change: "move signal {@code signalId} to {@code newState} only if
 * it is still in {@code expectedState}". Carries every column the store writes plus
 * the candle that justified the change.
 *
 * <p>Construction enforces the lifecycle graph; an illegal edge throws
 * {@link IllegalStateException}, so an invalid transition can never reach a store.
 */
public record SignalTransition(
    long signalId,
    SignalState expectedState,
    SignalState newState,
    SignalStatus status,
    SignalResult result,
    Instant entryHitAt,
    Instant closedAt,
    boolean released,
    Candle evidence,
    TransitionCause cause,
    String reason
) {
    public SignalTransition {
        Objects.requireNonNull(expectedState, "expectedState");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(cause, "cause");
        if (!expectedState.canTransitionTo(newState)) {
            throw new IllegalStateException("illegal transition " + expectedState + " -> " + newState
                                            + " for signal " + signalId);
        }
        if (status != SignalStatus.forState(newState)) {
            throw new IllegalStateException("status " + status + " does not match state " + newState);
        }
        if (newState.isTerminal() && closedAt == null) {
            throw new IllegalStateException("terminal transition to " + newState + " requires closedAt");
        }
    }

    public boolean isTerminal() {
        return newState.isTerminal();
    }

    /** CANDIDATE → WAITING_FOR_ENTRY once the release gate passes. */
    public static SignalTransition release(Signal signal, String reason) {
        return of(signal, SignalState.WAITING_FOR_ENTRY, signal.entryHitAt(), null, true,
                  null, TransitionCause.RELEASE, reason);
    }

    public static SignalTransition entryHit(Signal signal, Candle candle) {
        return of(signal, SignalState.ENTRY_HIT, candle.timestamp(), null, signal.released(),
                  candle, TransitionCause.MARKET, "entry " + signal.entryPrice() + " touched");
    }

    public static SignalTransition takeProfit(Signal signal, Candle candle) {
        return of(signal, SignalState.TP_HIT, signal.entryHitAt(), candle.timestamp(), signal.released(),
                  candle, TransitionCause.MARKET, "take-profit " + signal.tp() + " reached");
    }

    public static SignalTransition stopLoss(Signal signal, Candle candle) {
        return of(signal, SignalState.SL_HIT, signal.entryHitAt(), candle.timestamp(), signal.released(),
                  candle, TransitionCause.MARKET, "stop-loss " + signal.sl() + " reached");
    }

    /** Entry never touched before {@code expiresAt}. */
    public static SignalTransition expire(Signal signal, Instant now) {
        return of(signal, SignalState.EXPIRED, signal.entryHitAt(), now, signal.released(),
                  null, TransitionCause.EXPIRY, "entry window closed at " + signal.expiresAt());
    }

    /** Administrative cancel: operator request or zombie reclamation. */
    public static SignalTransition cancel(Signal signal, Instant now, String reason) {
        return of(signal, SignalState.CANCELLED, signal.entryHitAt(), now, signal.released(),
                  null, TransitionCause.ADMINISTRATIVE, reason);
    }

    private static SignalTransition of(Signal signal, SignalState next, Instant entryHitAt, Instant closedAt,
                                       boolean released, Candle evidence, TransitionCause cause, String reason) {
        Objects.requireNonNull(signal.id(), "signal must be persisted before it can transition");
        return new SignalTransition(signal.id(), signal.state(), next, SignalStatus.forState(next),
                                    SignalResult.forState(next), entryHitAt, closedAt, released,
                                    evidence, cause, reason);
    }
}
