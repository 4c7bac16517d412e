package com.signalledger.common.exception;

/**
 * Entry / take-profit / stop-loss relationship broken at creation. Rejected before
 * persistence, never repaired.
 */
public class InvariantViolationException extends SignalLedgerException {

    public InvariantViolationException(String message) {
        super("signal", message);
    }
}
