package com.signalledger.common.outcome;

/** Adjudicated fate of an entered signal. */
public enum Outcome {
    HIT_TP,
    HIT_SL,
    /** No level touched within the candles provided. */
    EXPIRED
}
