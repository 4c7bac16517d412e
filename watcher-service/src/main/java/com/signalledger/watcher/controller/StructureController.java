package com.signalledger.watcher.controller;

import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.structure.StructureState;
import com.signalledger.common.structure.StructureStateEngine;
import com.signalledger.watcher.config.WatcherSettings;
import com.signalledger.watcher.dto.StructureHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/structure")
public class StructureController {

    private static final Logger log = LoggerFactory.getLogger(StructureController.class);

    private static final String SOURCE = "twelve-data";

    private final StructureStateEngine engine;
    private final CandleFeed feed;
    private final WatcherSettings settings;

    public StructureController(StructureStateEngine engine, CandleFeed feed, WatcherSettings settings) {
        this.engine   = engine;
        this.feed     = feed;
        this.settings = settings;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<StructureHealth>> health() {
        return Mono.just(ResponseEntity.ok(new StructureHealth(
            "UP", StructureStateEngine.ENGINE_NAME, StructureStateEngine.ENGINE_VERSION, "deterministic", false)));
    }

    @GetMapping("/{asset}")
    public Mono<ResponseEntity<StructureState>> analyze(@PathVariable String asset,
                                                        @RequestParam(required = false) String timeframe,
                                                        @RequestParam(required = false) Integer lookback) {
        String tf = timeframe == null ? settings.timeframe() : timeframe;
        int window = lookback == null ? settings.lookback() : lookback;
        log.info("Structure analysis requested. asset={} timeframe={} lookback={}", asset, tf, window);
        return feed.fetchCandles(asset, tf, window)
            .map(candles -> engine.analyze(candles, asset, tf, SOURCE))
            .map(ResponseEntity::ok);
    }
}
