package com.signalledger.watcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalledger.common.confidence.ConfidenceRefiner;
import com.signalledger.common.confidence.RefinerSettings;
import com.signalledger.common.lifecycle.LifecycleEvaluator;
import com.signalledger.common.outcome.OutcomeResolver;
import com.signalledger.common.structure.StructureEngineSettings;
import com.signalledger.common.structure.StructureStateEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class WatcherConfig {

    @Value("${watcher.enabled:true}")
    private boolean enabled;

    @Value("${watcher.poll-interval:30s}")
    private Duration pollInterval;

    @Value("${watcher.entry-window:35m}")
    private Duration entryWindow;

    @Value("${watcher.stale-after:95m}")
    private Duration staleAfter;

    @Value("${watcher.stalled-after:5m}")
    private Duration stalledAfter;

    @Value("${watcher.lookback:100}")
    private int lookback;

    @Value("${watcher.timeframe:M15}")
    private String timeframe;

    @Value("${watcher.concurrency:8}")
    private int concurrency;

    @Value("${watcher.publish-threshold:0.75}")
    private double publishThreshold;

    @Value("${watcher.backfill-lookback:500}")
    private int backfillLookback;

    // ── structure engine ──────────────────────────────────────────────────────
    @Value("${structure.sensitivity:2}")
    private int sensitivity;

    @Value("${structure.min-window:30}")
    private int minWindow;

    @Value("${structure.break-threshold:0.0001}")
    private double breakThreshold;

    @Value("${structure.dominance-window:20}")
    private int dominanceWindow;

    // ── confidence refiner ────────────────────────────────────────────────────
    @Value("${refiner.overlap-weight:1.2}")
    private double overlapWeight;

    @Value("${refiner.london-weight:1.0}")
    private double londonWeight;

    @Value("${refiner.off-session-weight:0.8}")
    private double offSessionWeight;

    @Value("${refiner.rollover-spread-factor:0.5}")
    private double rolloverSpreadFactor;

    @Bean
    public WatcherSettings watcherSettings() {
        return new WatcherSettings(enabled, pollInterval, entryWindow, staleAfter, stalledAfter,
                                   lookback, timeframe, concurrency, publishThreshold, backfillLookback);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StructureStateEngine structureStateEngine(Clock clock) {
        StructureEngineSettings defaults = StructureEngineSettings.defaults();
        StructureEngineSettings settings = new StructureEngineSettings(sensitivity, minWindow, breakThreshold,
            dominanceWindow, defaults.minTotalScore(), defaults.leadRatio(), defaults.maxConfidence());
        return new StructureStateEngine(settings, clock);
    }

    @Bean
    public ConfidenceRefiner confidenceRefiner() {
        RefinerSettings defaults = RefinerSettings.defaults();
        return new ConfidenceRefiner(new RefinerSettings(overlapWeight, londonWeight, offSessionWeight,
            defaults.volatilityLookback(), defaults.lowVolatilityRatio(), defaults.highVolatilityRatio(),
            defaults.lowVolatilityFactor(), defaults.highVolatilityFactor(), rolloverSpreadFactor));
    }

    @Bean
    public OutcomeResolver outcomeResolver() {
        return new OutcomeResolver();
    }

    @Bean
    public LifecycleEvaluator lifecycleEvaluator(OutcomeResolver outcomeResolver) {
        return new LifecycleEvaluator(staleAfter, outcomeResolver);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
