package com.signalledger.common.store;

import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.ValidationEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence of signals and their audit trail.
 *
 * <p>Every state change goes through {@link #applyTransition}, which is conditional on
 * the transition's expected prior state. Writers racing on the same signal therefore
 * resolve to exactly one winner; the loser observes {@code false} and nothing changes.
 */
public interface SignalStore {

    Flux<Signal> findNonTerminal();

    Mono<Signal> findById(long id);

    Flux<Signal> findByAsset(String asset);

    /** Persists a new signal and returns it with its generated id. */
    Mono<Signal> insert(Signal signal);

    /**
     * Writes the new state, status, result and timestamps together with a
     * {@link ValidationEvent}, atomically, only if the signal is still in
     * {@code transition.expectedState()}.
     *
     * @return {@code true} if this call performed the transition
     */
    Mono<Boolean> applyTransition(SignalTransition transition, Instant recordedAt);

    /** Records an operator acknowledgment, guarded like a transition. */
    Mono<Boolean> acknowledge(long id, SignalState expectedState, Instant at);

    Flux<ValidationEvent> findEvents(long signalId);

    /**
     * Runs {@code unit} as a single unit of work: when it errors, every write it made
     * through this store is rolled back.
     */
    <T> Mono<T> inTransaction(Mono<T> unit);
}
