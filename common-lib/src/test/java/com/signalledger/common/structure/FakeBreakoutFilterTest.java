package com.signalledger.common.structure;

import com.signalledger.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FakeBreakoutFilterTest {

    private static final Instant T = Instant.parse("2026-03-02T10:00:00Z");
    private static final double LEVEL = 1.1000;

    private final FakeBreakoutFilter filter = new FakeBreakoutFilter();

    private static Candle candle(int minute, double o, double h, double l, double c) {
        return Candle.of(T.plusSeconds(60L * minute), o, h, l, c);
    }

    private static StructureEvent bullishBreak(Candle c, boolean accepted) {
        double body = c.body() / c.range();
        return new StructureEvent(StructureEvent.Type.BOS, StructureDirection.BULLISH, LEVEL, 0, body, accepted);
    }

    @Nested
    @DisplayName("isFake()")
    class IsFake {

        @Test
        @DisplayName("wick-only break with a tiny body → fake")
        void wickBreak_isFake() {
            Candle breaker = candle(0, 1.0990, 1.1010, 1.0985, 1.0992);
            List<Candle> candles = List.of(breaker,
                candle(1, 1.0992, 1.0995, 1.0980, 1.0985),
                candle(2, 1.0985, 1.0990, 1.0975, 1.0980));
            assertTrue(filter.isFake(bullishBreak(breaker, false), candles));
        }

        @Test
        @DisplayName("strong accepted break with follow-through → genuine")
        void strongBreak_isGenuine() {
            Candle breaker = candle(0, 1.0990, 1.1022, 1.0988, 1.1020);
            List<Candle> candles = List.of(breaker,
                candle(1, 1.1020, 1.1030, 1.1015, 1.1028),
                candle(2, 1.1028, 1.1035, 1.1020, 1.1032));
            assertFalse(filter.isFake(bullishBreak(breaker, true), candles));
        }

        @Test
        @DisplayName("accepted break that immediately reverses with weak body → fake")
        void acceptedButReversed_isFake() {
            Candle breaker = candle(0, 1.1000, 1.1020, 1.0985, 1.1004);
            List<Candle> candles = List.of(breaker,
                candle(1, 1.1004, 1.1006, 1.0990, 1.0992),
                candle(2, 1.0992, 1.0995, 1.0980, 1.0985));
            assertTrue(filter.isFake(bullishBreak(breaker, true), candles));
        }

        @Test
        @DisplayName("strong break on the last candle → one criterion only, genuine")
        void lastCandle_noFollowThroughYet() {
            Candle breaker = candle(0, 1.0990, 1.1022, 1.0988, 1.1020);
            assertFalse(filter.isFake(bullishBreak(breaker, true), List.of(breaker)));
        }
    }

    @Nested
    @DisplayName("criteria")
    class Criteria {

        @Test
        @DisplayName("wicks over 60% of range → wick dominant")
        void wickDominant() {
            assertTrue(FakeBreakoutFilter.isWickDominant(candle(0, 1.1000, 1.1010, 1.0990, 1.1002)));
            assertFalse(FakeBreakoutFilter.isWickDominant(candle(0, 1.0990, 1.1010, 1.0988, 1.1008)));
        }

        @Test
        @DisplayName("zero-range candle is not wick dominant")
        void zeroRange() {
            assertFalse(FakeBreakoutFilter.isWickDominant(candle(0, 1.1, 1.1, 1.1, 1.1)));
        }

        @Test
        @DisplayName("one of two follow-up closes beyond level counts as follow-through")
        void halfFollowThrough() {
            Candle breaker = candle(0, 1.0990, 1.1022, 1.0988, 1.1020);
            List<Candle> candles = List.of(breaker,
                candle(1, 1.1020, 1.1025, 1.1005, 1.1010),
                candle(2, 1.1010, 1.1012, 1.0990, 1.0995));
            assertTrue(FakeBreakoutFilter.hasFollowThrough(bullishBreak(breaker, true), candles));
        }
    }
}
