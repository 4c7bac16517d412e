package com.signalledger.common.structure;

public enum StructureDirection {
    BULLISH,
    BEARISH,
    RANGING;

    public StructureDirection opposite() {
        return switch (this) {
            case BULLISH -> BEARISH;
            case BEARISH -> BULLISH;
            case RANGING -> RANGING;
        };
    }

    public String label() {
        return switch (this) {
            case BULLISH -> "Bullish";
            case BEARISH -> "Bearish";
            case RANGING -> "Ranging";
        };
    }
}
