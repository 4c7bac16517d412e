package com.signalledger.common.lifecycle;

import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalResult;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.SignalStatus;
import com.signalledger.common.model.TransitionCause;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.signalledger.common.model.SignalFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SignalTransitionTest {

    @Test
    @DisplayName("illegal edge → IllegalStateException")
    void illegalEdge() {
        assertThrows(IllegalStateException.class, () -> new SignalTransition(1L,
            SignalState.TP_HIT, SignalState.CANCELLED, SignalStatus.CLOSED, SignalResult.CANCELLED,
            null, at(10), true, null, TransitionCause.ADMINISTRATIVE, "late cancel"));
        assertThrows(IllegalStateException.class, () -> new SignalTransition(1L,
            SignalState.WAITING_FOR_ENTRY, SignalState.TP_HIT, SignalStatus.CLOSED, SignalResult.PROFIT,
            null, at(10), true, null, TransitionCause.MARKET, "skipped entry"));
    }

    @Test
    @DisplayName("status must match the new state")
    void statusMismatch() {
        assertThrows(IllegalStateException.class, () -> new SignalTransition(1L,
            SignalState.WAITING_FOR_ENTRY, SignalState.EXPIRED, SignalStatus.CLOSED, SignalResult.EXPIRED,
            null, at(40), true, null, TransitionCause.EXPIRY, "expired"));
    }

    @Test
    @DisplayName("terminal transition without closedAt is rejected")
    void terminalNeedsClosedAt() {
        assertThrows(IllegalStateException.class, () -> new SignalTransition(1L,
            SignalState.WAITING_FOR_ENTRY, SignalState.EXPIRED, SignalStatus.EXPIRED, SignalResult.EXPIRED,
            null, null, true, null, TransitionCause.EXPIRY, "expired"));
    }

    @Test
    @DisplayName("cancel from a terminal signal cannot be built")
    void cancelTerminal() {
        Signal closed = inState(buy(), SignalState.SL_HIT, at(5));
        assertThrows(IllegalStateException.class, () -> SignalTransition.cancel(closed, at(90), "operator"));
    }

    @Test
    @DisplayName("release marks the signal released and keeps it ACTIVE")
    void release() {
        Signal candidate = inState(buy(), SignalState.CANDIDATE, null);
        SignalTransition t = SignalTransition.release(candidate, "score 0.96");
        assertEquals(SignalState.WAITING_FOR_ENTRY, t.newState());
        assertEquals(SignalStatus.ACTIVE, t.status());
        assertTrue(t.released());
        assertEquals(TransitionCause.RELEASE, t.cause());
        assertFalse(t.isTerminal());
    }

    @Test
    @DisplayName("unsaved signal cannot transition")
    void unsaved() {
        Signal unsaved = buy().withId(null);
        assertThrows(NullPointerException.class, () -> SignalTransition.cancel(unsaved, at(5), "operator"));
    }
}
