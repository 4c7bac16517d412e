package com.signalledger.common.outcome;

import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signalledger.common.model.SignalFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OutcomeResolverTest {

    private final OutcomeResolver resolver = new OutcomeResolver();

    @Nested
    @DisplayName("BUY 1.1000 / tp 1.1020 / sl 1.0985")
    class Buy {

        private final Signal signal = buy();

        @Test
        @DisplayName("candle spanning both levels → HIT_SL")
        void bothLevels_stopLossWins() {
            assertEquals(Outcome.HIT_SL, resolver.resolve(signal, List.of(candle(at(5), 1.1025, 1.0980))));
        }

        @Test
        @DisplayName("only tp reached → HIT_TP")
        void takeProfit() {
            assertEquals(Outcome.HIT_TP, resolver.resolve(signal, List.of(candle(at(5), 1.1025, 1.0990))));
        }

        @Test
        @DisplayName("exact touch counts")
        void exactTouch() {
            assertEquals(Outcome.HIT_TP, resolver.resolve(signal, List.of(candle(at(5), 1.1020, 1.0990))));
            assertEquals(Outcome.HIT_SL, resolver.resolve(signal, List.of(candle(at(5), 1.1010, 1.0985))));
        }

        @Test
        @DisplayName("first deciding candle wins and is reported")
        void firstCandleWins() {
            Candle tp = candle(at(10), 1.1021, 1.0995);
            Resolution resolution = resolver.resolveDetailed(signal, List.of(
                candle(at(5), 1.1010, 1.0990), tp, candle(at(15), 1.1000, 1.0970)));
            assertEquals(Outcome.HIT_TP, resolution.outcome());
            assertSame(tp, resolution.trigger());
        }

        @Test
        @DisplayName("no level touched → EXPIRED without trigger")
        void noTouch() {
            Resolution resolution = resolver.resolveDetailed(signal, List.of(candle(at(5), 1.1010, 1.0990)));
            assertEquals(Outcome.EXPIRED, resolution.outcome());
            assertNull(resolution.trigger());
            assertEquals(Outcome.EXPIRED, resolver.resolve(signal, List.of()));
        }
    }

    @Nested
    @DisplayName("SELL 1.1000 / tp 1.0980 / sl 1.1015")
    class Sell {

        private final Signal signal = sell();

        @Test
        @DisplayName("candle spanning both levels → HIT_SL")
        void bothLevels_stopLossWins() {
            assertEquals(Outcome.HIT_SL, resolver.resolve(signal, List.of(candle(at(5), 1.1020, 1.0975))));
        }

        @Test
        @DisplayName("only tp reached → HIT_TP")
        void takeProfit() {
            assertEquals(Outcome.HIT_TP, resolver.resolve(signal, List.of(candle(at(5), 1.1010, 1.0975))));
        }

        @Test
        @DisplayName("price moving up without reaching sl → EXPIRED")
        void noTouch() {
            assertEquals(Outcome.EXPIRED, resolver.resolve(signal, List.of(candle(at(5), 1.1014, 1.0990))));
        }
    }

    @Nested
    @DisplayName("resolveFromEntry()")
    class FromEntry {

        private final Signal signal = inState(buy(), SignalState.ENTRY_HIT, at(15));

        @Test
        @DisplayName("entry candle reaching sl → HIT_SL on that candle")
        void entryCandleStopLoss() {
            Candle entry = candle(at(15), 1.1004, 1.0980);
            Resolution resolution = resolver.resolveFromEntry(signal, List.of(
                entry, candle(at(30), 1.1025, 1.1005)));
            assertEquals(Outcome.HIT_SL, resolution.outcome());
            assertSame(entry, resolution.trigger());
        }

        @Test
        @DisplayName("entry candle reaching only tp is not counted")
        void entryCandleTakeProfitIgnored() {
            assertEquals(Outcome.EXPIRED,
                resolver.resolveFromEntry(signal, List.of(candle(at(15), 1.1025, 1.0998))).outcome());
        }

        @Test
        @DisplayName("candles before the entry are ignored")
        void beforeEntryIgnored() {
            Candle tp = candle(at(30), 1.1025, 1.1005);
            Resolution resolution = resolver.resolveFromEntry(signal, List.of(
                candle(at(0), 1.1010, 1.0970), tp));
            assertEquals(Outcome.HIT_TP, resolution.outcome());
            assertSame(tp, resolution.trigger());
        }
    }

    @Nested
    @DisplayName("computeRMultiple()")
    class RMultiple {

        @Test
        @DisplayName("tp → +reward/risk, sl → -1, expired → 0")
        void values() {
            Signal signal = buy();
            assertEquals(20.0 / 15.0, resolver.computeRMultiple(Outcome.HIT_TP, signal), 1e-6);
            assertEquals(-1.0, resolver.computeRMultiple(Outcome.HIT_SL, signal));
            assertEquals(0.0, resolver.computeRMultiple(Outcome.EXPIRED, signal));
        }
    }
}
