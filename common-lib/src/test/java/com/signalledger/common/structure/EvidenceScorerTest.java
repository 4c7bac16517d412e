package com.signalledger.common.structure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceScorerTest {

    private final EvidenceScorer scorer = new EvidenceScorer();

    private static StructureEvent event(StructureEvent.Type type, double body, boolean accepted) {
        return new StructureEvent(type, StructureDirection.BULLISH, 1.1000, 12, body, accepted);
    }

    @Test
    @DisplayName("accepted strong BOS → 0.6 × 0.94 × 1.0")
    void strongBos() {
        EvidenceItem item = scorer.score(event(StructureEvent.Type.BOS, 0.8, true), false);
        assertEquals(EvidenceType.BOS, item.type());
        assertEquals(0.94, item.strength(), 1e-9);
        assertEquals(0.564, item.value(), 1e-9);
        assertEquals(12, item.candleIndex());
        assertEquals(1.1000, item.priceLevel());
    }

    @Test
    @DisplayName("CHoCH uses the lower base")
    void choch() {
        EvidenceItem item = scorer.score(event(StructureEvent.Type.CHOCH, 0.8, true), false);
        assertEquals(EvidenceType.CHOCH, item.type());
        assertEquals(0.47, item.value(), 1e-9);
    }

    @Test
    @DisplayName("rejected fake → negative value, fixed strength 0.8")
    void fake() {
        EvidenceItem item = scorer.score(event(StructureEvent.Type.BOS, 0.1, false), true);
        assertEquals(EvidenceType.FAKEOUT_REJECTED, item.type());
        assertEquals(0.8, item.strength(), 1e-9);
        assertEquals(-0.16, item.value(), 1e-9);
        assertTrue(item.description().startsWith("Fake bullish breakout rejected"));
    }

    @Test
    @DisplayName("strength and quality stay within 0..1")
    void bounds() {
        StructureEvent max = event(StructureEvent.Type.BOS, 1.0, true);
        StructureEvent min = event(StructureEvent.Type.BOS, 0.0, false);
        assertEquals(1.0, EvidenceScorer.strength(max), 1e-9);
        assertEquals(1.0, EvidenceScorer.quality(max), 1e-9);
        assertEquals(0.5, EvidenceScorer.strength(min), 1e-9);
        assertEquals(0.5, EvidenceScorer.quality(min), 1e-9);
    }
}
