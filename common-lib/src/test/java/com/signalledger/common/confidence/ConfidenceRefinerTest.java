package com.signalledger.common.confidence;

import com.signalledger.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceRefinerTest {

    private static final Instant OVERLAP  = Instant.parse("2026-03-02T14:00:00Z");
    private static final Instant LONDON   = Instant.parse("2026-03-02T08:30:00Z");
    private static final Instant ASIA     = Instant.parse("2026-03-02T03:00:00Z");
    private static final Instant ROLLOVER = Instant.parse("2026-03-02T22:00:00Z");

    private final ConfidenceRefiner refiner = new ConfidenceRefiner();

    /** Fifteen candles: fourteen with range 0.0010, then one with {@code lastRange}. */
    private static List<Candle> series(double lastRange) {
        List<Candle> candles = new ArrayList<>();
        Instant t = Instant.parse("2026-03-02T10:00:00Z");
        for (int i = 0; i < 14; i++) {
            candles.add(Candle.of(t.plusSeconds(300L * i), 1.1000, 1.1005, 1.0995, 1.1000));
        }
        candles.add(Candle.of(t.plusSeconds(300L * 14), 1.1000, 1.1000 + lastRange / 2, 1.1000 - lastRange / 2, 1.1000));
        return candles;
    }

    @Nested
    @DisplayName("calculateReleaseScore()")
    class ReleaseScoreTests {

        @Test
        @DisplayName("raw 0.8 in the overlap → 0.96 with session weight 1.2")
        void overlapBoost() {
            ReleaseScore score = refiner.calculateReleaseScore(0.8, OVERLAP, List.of());
            assertEquals(0.96, score.score(), 1e-9);
            assertEquals(1.2, score.sessionWeight());
            assertEquals("raw=0.8000;session=1.20;volatility=1.00;spread=1.00", score.explanation());
        }

        @Test
        @DisplayName("raw 0.8 at 03:00 UTC → 0.64")
        void offSessionPenalty() {
            assertEquals(0.64, refiner.calculateReleaseScore(0.8, ASIA, List.of()).score(), 1e-9);
        }

        @Test
        @DisplayName("London leaves the raw value untouched")
        void londonNeutral() {
            assertEquals(0.8, refiner.calculateReleaseScore(0.8, LONDON, List.of()).score(), 1e-9);
        }

        @Test
        @DisplayName("rollover band halves an off-session score")
        void rollover() {
            ReleaseScore score = refiner.calculateReleaseScore(0.8, ROLLOVER, List.of());
            assertEquals(0.32, score.score(), 1e-9);
            assertEquals(0.5, score.spreadFactor());
        }

        @Test
        @DisplayName("boosted score is clamped to 1.0")
        void clampedToOne() {
            assertEquals(1.0, refiner.calculateReleaseScore(1.0, OVERLAP, List.of()).score());
        }

        @Test
        @DisplayName("score is monotonic in raw confidence")
        void monotonic() {
            double previous = -1;
            for (int i = 0; i <= 20; i++) {
                double score = refiner.calculateReleaseScore(i / 20.0, ROLLOVER, series(0.0001)).score();
                assertTrue(score >= previous);
                assertTrue(score >= 0.0 && score <= 1.0);
                previous = score;
            }
        }

        @Test
        @DisplayName("raw outside [0, 1] or NaN → IllegalArgumentException")
        void invalidRaw() {
            assertThrows(IllegalArgumentException.class, () -> refiner.calculateReleaseScore(1.5, OVERLAP, List.of()));
            assertThrows(IllegalArgumentException.class, () -> refiner.calculateReleaseScore(-0.1, OVERLAP, List.of()));
            assertThrows(IllegalArgumentException.class, () -> refiner.calculateReleaseScore(Double.NaN, OVERLAP, List.of()));
        }
    }

    @Nested
    @DisplayName("volatilityFactor()")
    class Volatility {

        @Test
        @DisplayName("fewer than fifteen candles → neutral")
        void notEnoughHistory() {
            assertEquals(1.0, refiner.volatilityFactor(series(0.0030).subList(1, 15)));
            assertEquals(1.0, refiner.volatilityFactor(null));
        }

        @Test
        @DisplayName("last range 3× baseline → 0.6")
        void erratic() {
            assertEquals(0.6, refiner.volatilityFactor(series(0.0030)));
        }

        @Test
        @DisplayName("last range 0.4× baseline → 0.7")
        void dead() {
            assertEquals(0.7, refiner.volatilityFactor(series(0.0004)));
        }

        @Test
        @DisplayName("last range equal to baseline → 1.0")
        void normal() {
            assertEquals(1.0, refiner.volatilityFactor(series(0.0010)));
        }

        @Test
        @DisplayName("flat baseline → neutral")
        void flatBaseline() {
            List<Candle> candles = new ArrayList<>();
            Instant t = Instant.parse("2026-03-02T10:00:00Z");
            for (int i = 0; i < 15; i++) {
                candles.add(Candle.of(t.plusSeconds(300L * i), 1.1, 1.1, 1.1, 1.1));
            }
            assertEquals(1.0, refiner.volatilityFactor(candles));
        }
    }
}
