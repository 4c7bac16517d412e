package com.signalledger.common.exception;

/**
 * Root of the signal-ledger error taxonomy. The message is prefixed with the
 * component that raised it so that log lines read {@code [structure] ...}.
 */
public class SignalLedgerException extends RuntimeException {
    private final String component;

    public SignalLedgerException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SignalLedgerException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
