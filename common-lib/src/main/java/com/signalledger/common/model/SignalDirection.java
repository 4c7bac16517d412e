package com.signalledger.common.model;

public enum SignalDirection {
    BUY,
    SELL
}
