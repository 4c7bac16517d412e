package com.signalledger.watcher.controller;

import com.signalledger.common.model.Signal;
import com.signalledger.common.store.SignalStore;
import com.signalledger.watcher.dto.BackfillReport;
import com.signalledger.watcher.dto.ReleaseDecision;
import com.signalledger.watcher.dto.SignalDraft;
import com.signalledger.watcher.dto.SignalSnapshot;
import com.signalledger.watcher.service.OutcomeBackfillService;
import com.signalledger.watcher.service.SignalAdminService;
import com.signalledger.watcher.service.SignalReleaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operator-facing REST API for the signal lifecycle. Errors are mapped to status
 * codes by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    private static final Logger log = LoggerFactory.getLogger(SignalController.class);

    private final SignalReleaseService releaseService;
    private final SignalAdminService adminService;
    private final OutcomeBackfillService backfillService;
    private final SignalStore store;

    public SignalController(SignalReleaseService releaseService, SignalAdminService adminService,
                            OutcomeBackfillService backfillService, SignalStore store) {
        this.releaseService  = releaseService;
        this.adminService    = adminService;
        this.backfillService = backfillService;
        this.store           = store;
    }

    /** 201 when the draft was released, 200 with the rejected score otherwise. */
    @PostMapping
    public Mono<ResponseEntity<ReleaseDecision>> release(@RequestBody SignalDraft draft) {
        log.info("Release requested. asset={} timeframe={} direction={} raw={}",
                 draft.asset(), draft.timeframe(), draft.direction(), draft.rawConfidence());
        return releaseService.release(draft)
            .map(decision -> ResponseEntity.status(decision.released() ? HttpStatus.CREATED : HttpStatus.OK)
                                           .body(decision))
            .doOnError(e -> log.error("Release endpoint error. asset={}", draft.asset(), e));
    }

    @GetMapping("/active")
    public Flux<Signal> active() {
        return store.findNonTerminal();
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SignalSnapshot>> snapshot(@PathVariable long id) {
        return adminService.snapshot(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<Signal>> cancel(@PathVariable long id,
                                               @RequestParam(required = false) String reason) {
        log.info("Cancel requested. id={} reason={}", id, reason);
        return adminService.cancel(id, reason)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/acknowledge")
    public Mono<ResponseEntity<Signal>> acknowledge(@PathVariable long id) {
        log.info("Acknowledge requested. id={}", id);
        return adminService.acknowledge(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/backfill")
    public Mono<ResponseEntity<BackfillReport>> backfill(@RequestParam String asset) {
        log.info("Outcome backfill requested. asset={}", asset);
        return backfillService.backfill(asset)
            .map(ResponseEntity::ok);
    }
}
