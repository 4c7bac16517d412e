package com.signalledger.common.validation;

import com.signalledger.common.exception.InvariantViolationException;
import com.signalledger.common.model.SignalDirection;

/**
 * Creation-time invariants of a signal's price levels.
 * BUY: {@code sl < entry < tp}. SELL: {@code tp < entry < sl}.
 */
public final class SignalInvariants {

    private SignalInvariants() {}

    public static void validate(SignalDirection direction, double entry, double tp, double sl) {
        if (direction == null) {
            throw new InvariantViolationException("direction is required");
        }
        if (!Double.isFinite(entry) || !Double.isFinite(tp) || !Double.isFinite(sl)
                || entry <= 0 || tp <= 0 || sl <= 0) {
            throw new InvariantViolationException(
                "price levels must be finite and positive: entry=" + entry + " tp=" + tp + " sl=" + sl);
        }
        boolean ordered = switch (direction) {
            case BUY  -> sl < entry && entry < tp;
            case SELL -> tp < entry && entry < sl;
        };
        if (!ordered) {
            throw new InvariantViolationException(direction + " requires "
                + (direction == SignalDirection.BUY ? "sl < entry < tp" : "tp < entry < sl")
                + " but got entry=" + entry + " tp=" + tp + " sl=" + sl);
        }
    }

    /** Reward distance over risk distance. Callers validate first. */
    public static double rewardRiskRatio(double entry, double tp, double sl) {
        return Math.abs(tp - entry) / Math.abs(entry - sl);
    }
}
