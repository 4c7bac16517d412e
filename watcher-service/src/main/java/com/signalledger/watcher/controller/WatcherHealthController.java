package com.signalledger.watcher.controller;

import com.signalledger.watcher.health.WatcherHeartbeat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Liveness of the polling loop: 503 when it is disabled or has stalled. */
@RestController
@RequestMapping("/api/v1/watcher")
public class WatcherHealthController {

    private final WatcherHeartbeat heartbeat;

    public WatcherHealthController(WatcherHeartbeat heartbeat) {
        this.heartbeat = heartbeat;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<WatcherHeartbeat.Status>> health() {
        WatcherHeartbeat.Status status = heartbeat.status();
        return Mono.just(ResponseEntity.status(status.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                                       .body(status));
    }
}
