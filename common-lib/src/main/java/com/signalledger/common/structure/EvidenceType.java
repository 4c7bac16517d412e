package com.signalledger.common.structure;

public enum EvidenceType {
    BOS,                    // break in the direction of the prevailing structure
    CHOCH,                  // break against it
    FAKEOUT_REJECTED,       // break that failed the fake-breakout filter
    DOMINANCE,              // closes relative to the latest structural pivot
    INSUFFICIENT_STRUCTURE  // not enough swings to reason about
}
