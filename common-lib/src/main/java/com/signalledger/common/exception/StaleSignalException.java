package com.signalledger.common.exception;

import java.time.Duration;

/**
 * Raised when an operation would keep alive a signal that is already past the
 * zombie threshold. Such signals are resolved only by forced cancellation.
 */
public class StaleSignalException extends SignalLedgerException {
    private final long signalId;
    private final Duration age;

    public StaleSignalException(long signalId, Duration age, Duration threshold) {
        super("lifecycle", "signal " + signalId + " is stale (age " + age.toMinutes()
              + "m >= " + threshold.toMinutes() + "m) and can only be cancelled");
        this.signalId = signalId;
        this.age = age;
    }

    public long getSignalId() {
        return signalId;
    }

    public Duration getAge() {
        return age;
    }
}
