package com.signalledger.watcher.job;

/**
 * Result of checking one signal within a tick. {@code marketData} is false when the
 * feed could not deliver candles and only the zombie check ran.
 */
record SignalCheck(long signalId, Outcome outcome, int malformedCandles, boolean marketData) {

    enum Outcome {
        UNCHANGED,
        TRANSITIONED,
        RECLAIMED,
        /** Another writer moved the signal first; the guarded update matched nothing. */
        GUARD_LOST,
        FAILED
    }

    static SignalCheck failed(long signalId) {
        return new SignalCheck(signalId, Outcome.FAILED, 0, true);
    }
}
