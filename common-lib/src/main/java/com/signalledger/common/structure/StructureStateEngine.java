package com.signalledger.common.structure;

import com.signalledger.common.exception.DataInsufficientException;
import com.signalledger.common.model.Candle;
import com.signalledger.common.validation.CandleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Deterministic market-structure classifier: candle window in, {@link StructureState} out.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>{@link SwingDetector} : pivots with a fixed radius</li>
 *   <li>{@link StructureEventDetector} : BOS / CHoCH breaks of confirmed swings</li>
 *   <li>{@link FakeBreakoutFilter} : breaks that reverse become negative evidence</li>
 *   <li>{@link EvidenceScorer} : weighted per-direction scores</li>
 *   <li>dominance ratio, direction and capped confidence</li>
 * </ol>
 *
 * <p>No randomness and no shared mutable state; the trace id is derived from the
 * input, so identical windows give equal results. The only side effect is logging.
 */
public final class StructureStateEngine {

    private static final Logger log = LoggerFactory.getLogger(StructureStateEngine.class);

    public static final String ENGINE_NAME    = "structure-state-engine";
    public static final String ENGINE_VERSION = "1.0.0";

    private static final double DIRECTIONAL_CONSISTENCY_WEIGHT = 0.7;
    private static final double DIRECTIONAL_DOMINANCE_WEIGHT   = 0.3;

    private final StructureEngineSettings settings;
    private final SwingDetector swingDetector;
    private final StructureEventDetector eventDetector;
    private final FakeBreakoutFilter fakeFilter = new FakeBreakoutFilter();
    private final EvidenceScorer scorer = new EvidenceScorer();
    private final Clock clock;

    public StructureStateEngine(StructureEngineSettings settings, Clock clock) {
        this.settings      = Objects.requireNonNull(settings, "settings");
        this.clock         = Objects.requireNonNull(clock, "clock");
        this.swingDetector = new SwingDetector(settings.sensitivity());
        this.eventDetector = new StructureEventDetector(settings.sensitivity(), settings.breakThreshold());
    }

    public StructureEngineSettings settings() {
        return settings;
    }

    /**
     * Classifies the structure of {@code window} (chronological, oldest first).
     *
     * @throws DataInsufficientException when the window is shorter than {@code minWindow}
     * @throws com.signalledger.common.exception.MalformedCandleException on inconsistent
     *         or unordered candles
     */
    public StructureState analyze(List<Candle> window, String symbol, String timeframe, String source) {
        Objects.requireNonNull(window, "window");
        if (window.size() < settings.minWindow()) {
            throw new DataInsufficientException("structure", settings.minWindow(), window.size());
        }
        CandleValidator.requireValidSeries(window);

        String traceId = traceId(window, symbol, timeframe, source);
        List<SwingPoint> swings = swingDetector.detect(window);
        if (swings.size() < 2) {
            log.info("[{}] STRUCTURE_INSUFFICIENT symbol={} timeframe={} swings={}",
                     traceId, symbol, timeframe, swings.size());
            return new StructureState(StructureDirection.RANGING, 0.0, 0.0,
                List.of(EvidenceItem.note(EvidenceType.INSUFFICIENT_STRUCTURE,
                    "Insufficient swing points for structure analysis")),
                traceId, symbol, timeframe, source, clock.instant());
        }

        List<StructureEvent> events = eventDetector.detect(window, swings);
        List<EvidenceItem> evidence = new ArrayList<>(events.size() + 1);
        double bullish = 0.0;
        double bearish = 0.0;
        StructureEvent lastValid = null;
        int fakes = 0;

        for (StructureEvent event : events) {
            boolean fake = fakeFilter.isFake(event, window);
            EvidenceItem item = scorer.score(event, fake);
            evidence.add(item);
            if (event.direction() == StructureDirection.BULLISH) bullish += item.value();
            else                                                 bearish += item.value();
            if (fake) fakes++;
            else      lastValid = event;
        }
        bullish = Math.max(0.0, bullish);
        bearish = Math.max(0.0, bearish);

        double dominance = dominanceRatio(window, lastValid);
        StructureDirection direction = resolveDirection(bullish, bearish, lastValid);
        double confidence = confidence(direction, bullish, bearish, dominance);

        evidence.add(dominanceItem(window, lastValid, dominance));

        log.info("[{}] STRUCTURE_ANALYZED symbol={} timeframe={} direction={} confidence={} dominance={} "
                 + "swings={} events={} fakes={} bull={} bear={}",
                 traceId, symbol, timeframe, direction, confidence, dominance,
                 swings.size(), events.size(), fakes, round(bullish), round(bearish));

        return new StructureState(direction, confidence, dominance, evidence,
                                  traceId, symbol, timeframe, source, clock.instant());
    }

    // ── direction & confidence ────────────────────────────────────────────

    StructureDirection resolveDirection(double bullish, double bearish, StructureEvent lastValid) {
        double total = bullish + bearish;
        if (total < settings.minTotalScore()) {
            return StructureDirection.RANGING;
        }
        StructureDirection leading;
        if (bullish > bearish && bullish >= bearish * settings.leadRatio()) {
            leading = StructureDirection.BULLISH;
        } else if (bearish > bullish && bearish >= bullish * settings.leadRatio()) {
            leading = StructureDirection.BEARISH;
        } else {
            return StructureDirection.RANGING;
        }
        // most recent accepted structure must not contradict the aggregate
        if (lastValid != null && lastValid.direction() != leading) {
            return StructureDirection.RANGING;
        }
        return leading;
    }

    double confidence(StructureDirection direction, double bullish, double bearish, double dominance) {
        double total = bullish + bearish;
        if (total < settings.minTotalScore()) {
            return 0.0;
        }
        double consistency = Math.abs(bullish - bearish) / total;
        double raw = direction == StructureDirection.RANGING
            ? 1.0 - consistency
            : DIRECTIONAL_CONSISTENCY_WEIGHT * consistency + DIRECTIONAL_DOMINANCE_WEIGHT * dominance;
        return round(Math.min(settings.maxConfidence(), Math.max(0.0, raw)));
    }

    // ── dominance ─────────────────────────────────────────────────────────

    double dominanceRatio(List<Candle> window, StructureEvent pivot) {
        if (pivot == null) return 0.0;
        int from = Math.max(0, window.size() - settings.dominanceWindow());
        int dominant = 0;
        for (int i = from; i < window.size(); i++) {
            double close = window.get(i).close();
            boolean onSide = pivot.direction() == StructureDirection.BULLISH
                ? close > pivot.brokenLevel()
                : close < pivot.brokenLevel();
            if (onSide) dominant++;
        }
        return round((double) dominant / (window.size() - from));
    }

    private EvidenceItem dominanceItem(List<Candle> window, StructureEvent pivot, double dominance) {
        int span = Math.min(settings.dominanceWindow(), window.size());
        if (pivot == null) {
            return new EvidenceItem(EvidenceType.DOMINANCE,
                "No accepted structural pivot; dominance not measurable",
                null, null, null, null, 0.0);
        }
        String side = pivot.direction() == StructureDirection.BULLISH ? "above" : "below";
        String description = String.format(Locale.ROOT, "%d%% of last %d closes %s pivot %.5f",
            Math.round(dominance * 100), span, side, pivot.brokenLevel());
        return new EvidenceItem(EvidenceType.DOMINANCE, description, pivot.direction(),
            pivot.brokenLevel(), null, pivot.candleIndex(), dominance);
    }

    // ── helpers ───────────────────────────────────────────────────────────

    private String traceId(List<Candle> window, String symbol, String timeframe, String source) {
        String key = symbol + '|' + timeframe + '|' + source + '|'
            + window.get(0).timestamp() + '|' + window.get(window.size() - 1).timestamp() + '|'
            + window.size() + '|' + settings.sensitivity();
        UUID uuid = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
        return "struct-" + uuid.toString().substring(0, 8);
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
