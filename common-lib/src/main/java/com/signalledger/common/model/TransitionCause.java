package com.signalledger.common.model;

/**
 * Why a lifecycle transition happened. {@link #ADMINISTRATIVE} transitions
 * (zombie reclamation, operator cancel) are audited separately from
 * market-driven ones.
 */
public enum TransitionCause {
    RELEASE,
    MARKET,
    EXPIRY,
    ADMINISTRATIVE
}
