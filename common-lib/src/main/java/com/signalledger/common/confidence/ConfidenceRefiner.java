package com.signalledger.common.confidence;

import com.signalledger.common.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Adjusts a raw model confidence for market context before a signal is published.
 *
 * <pre>
 *   score = clamp(raw × session × volatility × spread, 0, 1)
 * </pre>
 *
 * <p>Stateless and deterministic. The factors only ever damp or boost the raw
 * value; the threshold decision belongs to the caller.
 */
public final class ConfidenceRefiner {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceRefiner.class);

    private final RefinerSettings settings;

    public ConfidenceRefiner(RefinerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ConfidenceRefiner() {
        this(RefinerSettings.defaults());
    }

    public RefinerSettings settings() {
        return settings;
    }

    /**
     * @param rawConfidence model confidence in [0, 1]
     * @param now           evaluation time, classified on UTC hours
     * @param recent        recent candles, oldest first; may be empty
     * @throws IllegalArgumentException when {@code rawConfidence} is NaN or outside [0, 1]
     */
    public ReleaseScore calculateReleaseScore(double rawConfidence, Instant now, List<Candle> recent) {
        if (Double.isNaN(rawConfidence) || rawConfidence < 0.0 || rawConfidence > 1.0) {
            throw new IllegalArgumentException("rawConfidence must be in [0, 1]: " + rawConfidence);
        }
        Objects.requireNonNull(now, "now");

        double session    = sessionWeight(now);
        double volatility = volatilityFactor(recent);
        double spread     = spreadFactor(now);
        double score      = round(Math.max(0.0, Math.min(1.0, rawConfidence * session * volatility * spread)));

        ReleaseScore result = new ReleaseScore(score, rawConfidence, session, volatility, spread);
        log.debug("RELEASE_SCORE score={} {}", score, result.explanation());
        return result;
    }

    public double sessionWeight(Instant now) {
        return switch (TradingSessionClassifier.classify(now)) {
            case LONDON_NY_OVERLAP -> settings.overlapWeight();
            case LONDON            -> settings.londonWeight();
            case OFF_SESSION       -> settings.offSessionWeight();
        };
    }

    /**
     * Compares the last candle's range against the mean true range of the
     * {@code volatilityLookback} candles before it. Returns 1.0 when there is not
     * enough history or the baseline is flat.
     */
    public double volatilityFactor(List<Candle> recent) {
        int lookback = settings.volatilityLookback();
        if (recent == null || recent.size() < lookback + 1) {
            return 1.0;
        }
        int last = recent.size() - 1;
        double sum = 0.0;
        for (int i = last - lookback; i < last; i++) {
            Candle c = recent.get(i);
            Double prevClose = i > 0 ? recent.get(i - 1).close() : null;
            sum += trueRange(c, prevClose);
        }
        double baseline = sum / lookback;
        if (baseline <= 0.0) {
            return 1.0;
        }
        double ratio = recent.get(last).range() / baseline;
        if (ratio < settings.lowVolatilityRatio())  return settings.lowVolatilityFactor();
        if (ratio > settings.highVolatilityRatio()) return settings.highVolatilityFactor();
        return 1.0;
    }

    public double spreadFactor(Instant now) {
        return TradingSessionClassifier.isRollover(now) ? settings.rolloverSpreadFactor() : 1.0;
    }

    static double trueRange(Candle c, Double prevClose) {
        if (prevClose == null) return c.range();
        return Math.max(c.range(),
               Math.max(Math.abs(c.high() - prevClose), Math.abs(c.low() - prevClose)));
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
