package com.signalledger.common.validation;

import com.signalledger.common.exception.MalformedCandleException;
import com.signalledger.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandleValidatorTest {

    private static final Instant T = Instant.parse("2026-03-02T10:00:00Z");

    private static Candle ok(int minute) {
        return Candle.of(T.plusSeconds(60L * minute), 1.1000, 1.1010, 1.0990, 1.1005);
    }

    @Test
    @DisplayName("consistent ordered series passes")
    void valid() {
        assertDoesNotThrow(() -> CandleValidator.requireValidSeries(List.of(ok(0), ok(1), ok(2))));
    }

    @Test
    @DisplayName("high below close → MalformedCandleException carrying the candle")
    void inconsistent() {
        Candle bad = Candle.of(T.plusSeconds(60), 1.1000, 1.1002, 1.0990, 1.1005);
        MalformedCandleException ex = assertThrows(MalformedCandleException.class,
            () -> CandleValidator.requireValidSeries(List.of(ok(0), bad)));
        assertSame(bad, ex.getCandle());
    }

    @Test
    @DisplayName("zero volume is allowed, negative volume is not")
    void volume() {
        assertTrue(ok(0).isConsistent());
        assertFalse(new Candle(T, 1.1, 1.1, 1.1, 1.1, -1).isConsistent());
    }

    @Test
    @DisplayName("sanitize drops malformed and out-of-order candles, keeps the rest")
    void sanitize() {
        Candle bad = Candle.of(T.plusSeconds(120), 1.1000, 1.0995, 1.0990, 1.1005);
        CandleValidator.Sanitized result = CandleValidator.sanitize(
            Arrays.asList(ok(0), ok(1), bad, ok(1), null, ok(3)));

        assertEquals(List.of(ok(0), ok(1), ok(3)), result.valid());
        assertEquals(3, result.rejected().size());
        assertTrue(result.hasRejected());
    }

    @Test
    @DisplayName("empty input → empty result")
    void empty() {
        assertFalse(CandleValidator.sanitize(List.of()).hasRejected());
        assertTrue(CandleValidator.sanitize(null).valid().isEmpty());
    }
}
