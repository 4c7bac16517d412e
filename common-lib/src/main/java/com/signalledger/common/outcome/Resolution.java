package com.signalledger.common.outcome;

import com.signalledger.common.model.Candle;

/**
 * An {@link Outcome} plus the candle that decided it ({@code null} for
 * {@link Outcome#EXPIRED}).
 */
public record Resolution(Outcome outcome, Candle trigger) {

    public static Resolution expired() {
        return new Resolution(Outcome.EXPIRED, null);
    }
}
