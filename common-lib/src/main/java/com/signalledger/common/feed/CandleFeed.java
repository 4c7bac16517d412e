package com.signalledger.common.feed;

import com.signalledger.common.model.Candle;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Upstream market data. Implementations return candles oldest first and signal
 * provider trouble with {@link com.signalledger.common.exception.FeedUnavailableException}.
 */
public interface CandleFeed {

    Mono<List<Candle>> fetchCandles(String asset, String timeframe, int lookback);

    Mono<Double> fetchLatestPrice(String asset);
}
