package com.signalledger.common.exception;

/** Transient candle-feed failure. Retried on the next watcher tick; never corrupts state. */
public class FeedUnavailableException extends SignalLedgerException {

    public FeedUnavailableException(String message) {
        super("feed", message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super("feed", message, cause);
    }
}
