package com.signalledger.common.exception;

import com.signalledger.common.model.Candle;

/** A candle that breaks the OHLC invariant or the ordering of its series. */
public class MalformedCandleException extends SignalLedgerException {
    private final transient Candle candle;

    public MalformedCandleException(Candle candle, String message) {
        super("candle", message);
        this.candle = candle;
    }

    public Candle getCandle() {
        return candle;
    }
}
