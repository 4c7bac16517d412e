package com.signalledger.watcher.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalledger.common.exception.FeedUnavailableException;
import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link CandleFeed} over a Twelve-Data style REST API.
 *
 * <pre>
 *   GET /time_series?symbol=EUR/USD&amp;interval=15min&amp;outputsize=100&amp;timezone=UTC
 *   GET /price?symbol=EUR/USD
 * </pre>
 *
 * <p>The provider returns candles newest first with string-encoded prices; they are
 * reversed to chronological order here. Provider errors ({@code "status":"error"}),
 * HTTP failures and timeouts all surface as {@link FeedUnavailableException}. Candle
 * consistency is not checked here; callers sanitize. A bar with a missing or unreadable
 * {@code datetime} is kept with a {@code null} timestamp so that sanitizing rejects and
 * counts it while the rest of the response stays usable.
 */
@Component
public class HttpCandleFeed implements CandleFeed {

    private static final Logger log = LoggerFactory.getLogger(HttpCandleFeed.class);

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<String, String> INTERVALS = Map.of(
        "M1",  "1min",
        "M5",  "5min",
        "M15", "15min",
        "M30", "30min",
        "H1",  "1h",
        "H4",  "4h",
        "D1",  "1day"
    );

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${feed.api-key:demo}")
    private String apiKey;

    public HttpCandleFeed(@Qualifier("feedWebClient") WebClient feedWebClient, ObjectMapper objectMapper) {
        this.webClient    = feedWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<Candle>> fetchCandles(String asset, String timeframe, int lookback) {
        String symbol   = providerSymbol(asset);
        String interval = providerInterval(timeframe);
        return webClient.get()
            .uri(uri -> uri.path("/time_series")
                .queryParam("symbol", symbol)
                .queryParam("interval", interval)
                .queryParam("outputsize", lookback)
                .queryParam("timezone", "UTC")
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(this::parseTimeSeries)
            .onErrorMap(e -> !(e instanceof FeedUnavailableException),
                        e -> new FeedUnavailableException("time_series failed for " + asset + "/" + timeframe, e))
            .doOnSuccess(candles -> log.debug("Candles fetched. asset={} timeframe={} count={}",
                                              asset, timeframe, candles == null ? 0 : candles.size()))
            .doOnError(e -> log.warn("FEED_UNAVAILABLE asset={} timeframe={} reason={}", asset, timeframe, e.getMessage()));
    }

    @Override
    public Mono<Double> fetchLatestPrice(String asset) {
        String symbol = providerSymbol(asset);
        return webClient.get()
            .uri(uri -> uri.path("/price")
                .queryParam("symbol", symbol)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(this::parsePrice)
            .onErrorMap(e -> !(e instanceof FeedUnavailableException),
                        e -> new FeedUnavailableException("price failed for " + asset, e))
            .doOnError(e -> log.warn("FEED_UNAVAILABLE asset={} reason={}", asset, e.getMessage()));
    }

    // ── parsing ───────────────────────────────────────────────────────────────

    List<Candle> parseTimeSeries(String json) {
        JsonNode root = readTree(json);
        JsonNode values = root.path("values");
        if (!values.isArray()) {
            throw new FeedUnavailableException("time_series response without values");
        }
        List<Candle> candles = new ArrayList<>(values.size());
        for (JsonNode bar : values) {
            candles.add(new Candle(
                candleTime(bar.path("datetime").asText()),
                bar.path("open").asDouble(Double.NaN),
                bar.path("high").asDouble(Double.NaN),
                bar.path("low").asDouble(Double.NaN),
                bar.path("close").asDouble(Double.NaN),
                bar.path("volume").asDouble(0.0)));
        }
        // provider order is newest first
        Collections.reverse(candles);
        return candles;
    }

    double parsePrice(String json) {
        JsonNode price = readTree(json).path("price");
        if (price.isMissingNode() || price.isNull()) {
            throw new FeedUnavailableException("price response without price");
        }
        return price.asDouble();
    }

    private JsonNode readTree(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new FeedUnavailableException("unreadable provider response", e);
        }
        if ("error".equalsIgnoreCase(root.path("status").asText())) {
            throw new FeedUnavailableException("provider error " + root.path("code").asText("?")
                                               + ": " + root.path("message").asText());
        }
        return root;
    }

    /** Lenient per-bar variant of {@link #parseTime(String)}: {@code null} when unreadable. */
    private static Instant candleTime(String text) {
        try {
            return parseTime(text);
        } catch (FeedUnavailableException e) {
            log.warn("MALFORMED_CANDLE_TIME datetime='{}' (bar kept without timestamp)", text);
            return null;
        }
    }

    static Instant parseTime(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(text, DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new FeedUnavailableException("unparseable candle time '" + text + "'", e);
        }
    }

    /** {@code EURUSD} → {@code EUR/USD}; anything else is passed through. */
    static String providerSymbol(String asset) {
        if (asset.length() == 6 && asset.chars().allMatch(Character::isLetter)) {
            return asset.substring(0, 3).toUpperCase(Locale.ROOT) + "/"
                 + asset.substring(3).toUpperCase(Locale.ROOT);
        }
        return asset;
    }

    static String providerInterval(String timeframe) {
        return INTERVALS.getOrDefault(timeframe.toUpperCase(Locale.ROOT), timeframe);
    }
}
