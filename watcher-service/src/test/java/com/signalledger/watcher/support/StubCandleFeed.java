package com.signalledger.watcher.support;

import com.signalledger.common.exception.FeedUnavailableException;
import com.signalledger.common.feed.CandleFeed;
import com.signalledger.common.model.Candle;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class StubCandleFeed implements CandleFeed {

    private final Map<String, List<Candle>> candles = new ConcurrentHashMap<>();
    private final Map<String, Double> prices = new ConcurrentHashMap<>();
    private final AtomicInteger candleCalls = new AtomicInteger();
    private volatile boolean unavailable;

    public StubCandleFeed candles(String asset, List<Candle> series) {
        candles.put(asset, series);
        return this;
    }

    public StubCandleFeed price(String asset, double price) {
        prices.put(asset, price);
        return this;
    }

    public StubCandleFeed unavailable() {
        this.unavailable = true;
        return this;
    }

    public int candleCalls() {
        return candleCalls.get();
    }

    @Override
    public Mono<List<Candle>> fetchCandles(String asset, String timeframe, int lookback) {
        return Mono.defer(() -> {
            candleCalls.incrementAndGet();
            if (unavailable) {
                return Mono.error(new FeedUnavailableException("provider returned 503"));
            }
            return Mono.just(candles.getOrDefault(asset, List.of()));
        });
    }

    @Override
    public Mono<Double> fetchLatestPrice(String asset) {
        return Mono.defer(() -> {
            if (unavailable) {
                return Mono.error(new FeedUnavailableException("provider returned 503"));
            }
            return Mono.justOrEmpty(prices.get(asset));
        });
    }
}
