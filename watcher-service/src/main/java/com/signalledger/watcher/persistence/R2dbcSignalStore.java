package com.signalledger.watcher.persistence;

import com.signalledger.common.lifecycle.SignalTransition;
import com.signalledger.common.model.Candle;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.SignalDirection;
import com.signalledger.common.model.SignalResult;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.model.SignalStatus;
import com.signalledger.common.model.TransitionCause;
import com.signalledger.common.model.ValidationEvent;
import com.signalledger.common.store.SignalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * {@link SignalStore} on Spring Data R2DBC.
 *
 * <p>A transition is one guarded {@code UPDATE ... WHERE state = :expectedState} plus
 * the audit insert, inside a single reactive transaction. When the guard matches no
 * row the audit insert is skipped and the call reports {@code false}.
 */
@Component
public class R2dbcSignalStore implements SignalStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSignalStore.class);

    private final SignalRepository signalRepository;
    private final ValidationEventRepository eventRepository;
    private final TransactionalOperator tx;

    public R2dbcSignalStore(SignalRepository signalRepository,
                            ValidationEventRepository eventRepository,
                            ReactiveTransactionManager transactionManager) {
        this.signalRepository = signalRepository;
        this.eventRepository  = eventRepository;
        this.tx               = TransactionalOperator.create(transactionManager);
    }

    @Override
    public Flux<Signal> findNonTerminal() {
        return signalRepository.findNonTerminal().map(R2dbcSignalStore::toSignal);
    }

    @Override
    public Mono<Signal> findById(long id) {
        return signalRepository.findById(id).map(R2dbcSignalStore::toSignal);
    }

    @Override
    public Flux<Signal> findByAsset(String asset) {
        return signalRepository.findByAssetOrderByGeneratedAtAsc(asset).map(R2dbcSignalStore::toSignal);
    }

    @Override
    public Mono<Signal> insert(Signal signal) {
        SignalEntity entity = toEntity(signal);
        entity.setId(null);
        return signalRepository.save(entity)
            .map(R2dbcSignalStore::toSignal)
            .doOnSuccess(s -> log.info("Signal persisted. id={} asset={} direction={} state={}",
                                       s.id(), s.asset(), s.direction(), s.state()));
    }

    @Override
    public Mono<Boolean> applyTransition(SignalTransition t, Instant recordedAt) {
        Mono<Boolean> unit = signalRepository.transitionIfState(
                t.signalId(), t.expectedState().name(), t.newState().name(), t.status().name(),
                t.result() == null ? null : t.result().name(),
                toLocal(t.entryHitAt()), toLocal(t.closedAt()), t.released())
            .flatMap(rows -> rows == 0
                ? Mono.just(false)
                : eventRepository.save(toEventEntity(t, recordedAt)).thenReturn(true));
        return tx.transactional(unit);
    }

    @Override
    public Mono<Boolean> acknowledge(long id, SignalState expectedState, Instant at) {
        return signalRepository.acknowledgeIfState(id, expectedState.name(), toLocal(at))
            .map(rows -> rows > 0);
    }

    @Override
    public Flux<ValidationEvent> findEvents(long signalId) {
        return eventRepository.findBySignalId(signalId).map(R2dbcSignalStore::toEvent);
    }

    /** Nested {@link #applyTransition} calls join the outer transaction. */
    @Override
    public <T> Mono<T> inTransaction(Mono<T> unit) {
        return tx.transactional(unit);
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    static Signal toSignal(SignalEntity e) {
        return new Signal(e.getId(), e.getAsset(), e.getTimeframe(),
            SignalDirection.valueOf(e.getDirection()),
            e.getEntryPrice(), e.getTp(), e.getSl(), e.getRewardRiskRatio(),
            e.getRawConfidence(), e.getReleaseConfidence(),
            SignalState.valueOf(e.getState()),
            SignalStatus.valueOf(e.getStatus()),
            e.getResult() == null ? null : SignalResult.valueOf(e.getResult()),
            toInstant(e.getGeneratedAt()), toInstant(e.getExpiresAt()), toInstant(e.getEntryHitAt()),
            toInstant(e.getClosedAt()), toInstant(e.getAcknowledgedAt()), e.isReleased());
    }

    static SignalEntity toEntity(Signal s) {
        SignalEntity e = new SignalEntity();
        e.setId(s.id());
        e.setAsset(s.asset());
        e.setTimeframe(s.timeframe());
        e.setDirection(s.direction().name());
        e.setEntryPrice(s.entryPrice());
        e.setTp(s.tp());
        e.setSl(s.sl());
        e.setRewardRiskRatio(s.rewardRiskRatio());
        e.setRawConfidence(s.rawConfidence());
        e.setReleaseConfidence(s.releaseConfidence());
        e.setState(s.state().name());
        e.setStatus(SignalStatus.forState(s.state()).name());
        e.setResult(s.result() == null ? null : s.result().name());
        e.setGeneratedAt(toLocal(s.generatedAt()));
        e.setExpiresAt(toLocal(s.expiresAt()));
        e.setEntryHitAt(toLocal(s.entryHitAt()));
        e.setClosedAt(toLocal(s.closedAt()));
        e.setAcknowledgedAt(toLocal(s.acknowledgedAt()));
        e.setReleased(s.released());
        return e;
    }

    private static ValidationEventEntity toEventEntity(SignalTransition t, Instant recordedAt) {
        ValidationEventEntity e = new ValidationEventEntity();
        e.setSignalId(t.signalId());
        e.setFromState(t.expectedState().name());
        e.setToState(t.newState().name());
        e.setCause(t.cause().name());
        e.setReason(t.reason());
        Candle c = t.evidence();
        if (c != null) {
            e.setCandleTime(toLocal(c.timestamp()));
            e.setCandleOpen(c.open());
            e.setCandleHigh(c.high());
            e.setCandleLow(c.low());
            e.setCandleClose(c.close());
        }
        e.setRecordedAt(toLocal(recordedAt));
        return e;
    }

    private static ValidationEvent toEvent(ValidationEventEntity e) {
        return new ValidationEvent(e.getId(), e.getSignalId(),
            SignalState.valueOf(e.getFromState()), SignalState.valueOf(e.getToState()),
            TransitionCause.valueOf(e.getCause()), e.getReason(),
            toInstant(e.getCandleTime()), e.getCandleOpen(), e.getCandleHigh(), e.getCandleLow(),
            e.getCandleClose(), toInstant(e.getRecordedAt()));
    }

    private static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
