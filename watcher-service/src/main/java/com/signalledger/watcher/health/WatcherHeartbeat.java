package com.signalledger.watcher.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.watcher.config.WatcherSettings;
import com.signalledger.watcher.job.TickReport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness of the lifecycle loop. Signals are only ever resolved by the loop, so a
 * loop that stopped ticking must show up as unhealthy rather than as "no news".
 *
 * <p>A loop that keeps ticking while the feed is down is not resolving anything either:
 * once no tick has seen market data for {@code stalledAfter}, the status is
 * {@code DEGRADED}.
 */
@Component
public class WatcherHeartbeat {

    private final WatcherSettings settings;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicReference<TickReport> lastTick = new AtomicReference<>();
    private final AtomicReference<Instant> lastMarketDataAt = new AtomicReference<>();

    public WatcherHeartbeat(WatcherSettings settings, Clock clock) {
        this.settings  = settings;
        this.clock     = clock;
        this.startedAt = clock.instant();
    }

    public void recordTick(TickReport report) {
        lastTick.set(report);
        if (report.hadMarketData()) {
            lastMarketDataAt.set(report.tickTime());
        }
    }

    public Status status() {
        Instant now = clock.instant();
        TickReport last = lastTick.get();
        Instant marketDataAt = lastMarketDataAt.get();
        if (!settings.enabled()) {
            return new Status("DISABLED", false, null, null, marketDataAt, last);
        }
        Instant lastTickAt = last == null ? null : last.tickTime();
        Duration silence = Duration.between(lastTickAt == null ? startedAt : lastTickAt, now);
        if (silence.compareTo(settings.stalledAfter()) > 0) {
            return new Status("STALLED", false, lastTickAt, silence.toSeconds(), marketDataAt, last);
        }
        Duration blind = Duration.between(marketDataAt == null ? startedAt : marketDataAt, now);
        if (blind.compareTo(settings.stalledAfter()) > 0) {
            return new Status("DEGRADED", false, lastTickAt, silence.toSeconds(), marketDataAt, last);
        }
        return new Status("UP", true, lastTickAt, silence.toSeconds(), marketDataAt, last);
    }

    public record Status(
        @JsonProperty("status")              String status,
        @JsonProperty("healthy")             boolean healthy,
        @JsonProperty("lastTickAt")          Instant lastTickAt,
        @JsonProperty("secondsSinceLastTick") Long secondsSinceLastTick,
        @JsonProperty("lastMarketDataAt")    Instant lastMarketDataAt,
        @JsonProperty("lastReport")          TickReport lastReport
    ) {}
}
