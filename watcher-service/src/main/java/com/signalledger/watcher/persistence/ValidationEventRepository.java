package com.signalledger.watcher.persistence;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ValidationEventRepository extends ReactiveCrudRepository<ValidationEventEntity, Long> {

    @Query("SELECT * FROM signal_validation_events WHERE signal_id = :signalId ORDER BY recorded_at ASC, id ASC")
    Flux<ValidationEventEntity> findBySignalId(Long signalId);
}
