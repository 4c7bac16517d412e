package com.signalledger.watcher.persistence;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface SignalRepository extends ReactiveCrudRepository<SignalEntity, Long> {

    @Query("""
        SELECT * FROM signals
        WHERE state IN ('CANDIDATE', 'WAITING_FOR_ENTRY', 'ENTRY_HIT')
        ORDER BY generated_at ASC, id ASC
        """)
    Flux<SignalEntity> findNonTerminal();

    Flux<SignalEntity> findByAssetOrderByGeneratedAtAsc(String asset);

    /**
     * Optimistic state transition: only touches the row while it is still in
     * {@code expectedState}. Returns the number of rows updated (0 or 1).
     */
    @Modifying
    @Query("""
        UPDATE signals
        SET state        = :newState,
            status       = :status,
            result       = :result,
            entry_hit_at = :entryHitAt,
            closed_at    = :closedAt,
            released     = :released
        WHERE id = :id
          AND state = :expectedState
        """)
    Mono<Integer> transitionIfState(Long id, String expectedState, String newState, String status,
                                    String result, LocalDateTime entryHitAt, LocalDateTime closedAt,
                                    boolean released);

    @Modifying
    @Query("""
        UPDATE signals
        SET acknowledged_at = :acknowledgedAt
        WHERE id = :id
          AND state = :expectedState
        """)
    Mono<Integer> acknowledgeIfState(Long id, String expectedState, LocalDateTime acknowledgedAt);
}
