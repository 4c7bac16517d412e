package com.signalledger.common.exception;

/** Candle window too short for structure analysis; the caller must wait for more data. */
public class DataInsufficientException extends SignalLedgerException {
    private final int required;
    private final int actual;

    public DataInsufficientException(String component, int required, int actual) {
        super(component, "window of " + actual + " candles is below the required " + required);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
