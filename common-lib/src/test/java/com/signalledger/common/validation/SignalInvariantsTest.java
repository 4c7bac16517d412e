package com.signalledger.common.validation;

import com.signalledger.common.exception.InvariantViolationException;
import com.signalledger.common.model.SignalDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalInvariantsTest {

    @Test
    @DisplayName("well-ordered BUY and SELL levels pass")
    void valid() {
        assertDoesNotThrow(() -> SignalInvariants.validate(SignalDirection.BUY, 1.1000, 1.1020, 1.0985));
        assertDoesNotThrow(() -> SignalInvariants.validate(SignalDirection.SELL, 1.1000, 1.0980, 1.1015));
    }

    @Test
    @DisplayName("BUY with tp below entry → InvariantViolationException")
    void buyInverted() {
        InvariantViolationException ex = assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(SignalDirection.BUY, 1.1000, 1.0980, 1.0985));
        assertTrue(ex.getMessage().startsWith("[signal] BUY requires sl < entry < tp"));
    }

    @Test
    @DisplayName("SELL with sl below entry → InvariantViolationException")
    void sellInverted() {
        assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(SignalDirection.SELL, 1.1000, 1.0980, 1.0990));
    }

    @Test
    @DisplayName("equal levels, non-positive or non-finite prices are rejected")
    void degenerate() {
        assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(SignalDirection.BUY, 1.1000, 1.1000, 1.0985));
        assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(SignalDirection.BUY, 0.0, 1.1020, -1.0));
        assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(SignalDirection.SELL, Double.NaN, 1.0980, 1.1015));
        assertThrows(InvariantViolationException.class,
            () -> SignalInvariants.validate(null, 1.1000, 1.1020, 1.0985));
    }

    @Test
    @DisplayName("reward/risk ratio is distance to tp over distance to sl")
    void rewardRisk() {
        assertEquals(2.0, SignalInvariants.rewardRiskRatio(1.1000, 1.1020, 1.0990), 1e-9);
    }
}
