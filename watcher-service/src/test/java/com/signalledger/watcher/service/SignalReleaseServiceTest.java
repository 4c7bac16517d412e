package com.signalledger.watcher.service;

import com.signalledger.common.confidence.ConfidenceRefiner;
import com.signalledger.common.exception.InvariantViolationException;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalDirection;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.TransitionCause;
import com.signalledger.watcher.dto.SignalDraft;
import com.signalledger.watcher.support.InMemorySignalStore;
import com.signalledger.watcher.support.RecordingPublisher;
import com.signalledger.watcher.support.StubCandleFeed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static com.signalledger.watcher.support.WatcherFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SignalReleaseServiceTest {

    private final InMemorySignalStore store = new InMemorySignalStore();
    private final StubCandleFeed feed = new StubCandleFeed();
    private final RecordingPublisher publisher = new RecordingPublisher();

    private final SignalReleaseService service = new SignalReleaseService(store, feed, new ConfidenceRefiner(),
        publisher, settings(), Clock.fixed(T0, ZoneOffset.UTC));

    private static SignalDraft draft(double raw) {
        return new SignalDraft("EURUSD", "M5", SignalDirection.BUY, 1.1000, 1.1020, 1.0985, raw);
    }

    @Test
    @DisplayName("score above threshold → persisted, WAITING_FOR_ENTRY, published once")
    void released() {
        StepVerifier.create(service.release(draft(0.8)))
            .assertNext(decision -> {
                assertTrue(decision.released());
                assertEquals(0.96, decision.score().score(), 1e-9);
                Signal s = decision.signal();
                assertEquals(SignalState.WAITING_FOR_ENTRY, s.state());
                assertTrue(s.released());
                assertEquals(0.96, s.releaseConfidence(), 1e-9);
                assertEquals(T0, s.generatedAt());
                assertEquals(T0.plus(Duration.ofMinutes(35)), s.expiresAt());
            })
            .verifyComplete();

        assertEquals(1, publisher.published().size());
        assertEquals(SignalState.WAITING_FOR_ENTRY, publisher.published().get(0).newState());
        assertEquals(TransitionCause.RELEASE, store.events().get(0).cause());
        assertEquals(SignalState.CANDIDATE, store.events().get(0).fromState());
    }

    @Test
    @DisplayName("score below threshold → rejected, nothing persisted or published")
    void rejected() {
        StepVerifier.create(service.release(draft(0.6)))
            .assertNext(decision -> {
                assertFalse(decision.released());
                assertEquals(0.72, decision.score().score(), 1e-9);
                assertNull(decision.signal());
                assertTrue(decision.reason().contains("below threshold"));
            })
            .verifyComplete();

        StepVerifier.create(store.findByAsset("EURUSD")).verifyComplete();
        assertTrue(publisher.published().isEmpty());
    }

    @Test
    @DisplayName("inconsistent levels are rejected before anything is stored")
    void invariantViolation() {
        SignalDraft bad = new SignalDraft("EURUSD", "M5", SignalDirection.BUY, 1.1000, 1.0990, 1.0985, 0.9);

        StepVerifier.create(service.release(bad))
            .expectError(InvariantViolationException.class)
            .verify();

        StepVerifier.create(store.findByAsset("EURUSD")).verifyComplete();
        assertTrue(publisher.published().isEmpty());
    }

    @Test
    @DisplayName("raw confidence outside [0, 1] is an argument error")
    void rawOutOfRange() {
        StepVerifier.create(service.release(draft(1.5)))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    @DisplayName("feed outage only drops the volatility context")
    void feedDown() {
        feed.unavailable();
        StepVerifier.create(service.release(draft(0.8)))
            .assertNext(decision -> {
                assertTrue(decision.released());
                assertEquals(1.0, decision.score().volatilityFactor());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("release transition failing rolls back the insert; no CANDIDATE is left behind")
    void releaseTransitionFails() {
        store.failTransitionsOf(1L);

        StepVerifier.create(service.release(draft(0.8)))
            .expectError(IllegalStateException.class)
            .verify();

        StepVerifier.create(store.findByAsset("EURUSD")).verifyComplete();
        assertTrue(store.events().isEmpty());
        assertTrue(publisher.published().isEmpty());
    }
}
