package com.swarmverify.resolution.guard;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per-client quota guarding the reasoning backend that every resolution consumes.
 *
 * <p>Each client key gets its own resilience4j {@link AtomicRateLimiter} granting {@code capacity}
 * permits per window of {@code capacity / refillPerSecond} seconds. Acquisition never waits: a
 * request costing more than the permits left in the current window is rejected without consuming any.
 *
 * <p>Limiters live in a Caffeine cache bounded by {@code maxClients} and expiring after one idle window.
 * A limiter idle for a full window is back at capacity, so eviction never forgets spent quota.
 */
public class ResolutionRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ResolutionRateLimiter.class);

    public static final int RESOLVE_COST          = 5;
    public static final int BATCH_COST_PER_MARKET = 10;
    public static final int DEFAULT_MAX_CLIENTS   = 10_000;

    private final int capacity;
    private final Duration window;
    private final RateLimiterConfig config;
    private final Cache<String, AtomicRateLimiter> limiters;

    public ResolutionRateLimiter(int capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, DEFAULT_MAX_CLIENTS, Ticker.systemTicker());
    }

    public ResolutionRateLimiter(int capacity, double refillPerSecond, int maxClients, Ticker ticker) {
        if (capacity <= 0 || refillPerSecond <= 0 || maxClients <= 0) {
            throw new IllegalArgumentException("capacity, refillPerSecond and maxClients must be positive");
        }
        this.capacity = capacity;
        this.window   = Duration.ofNanos(Math.max(1L, Math.round(capacity / refillPerSecond * 1_000_000_000L)));
        this.config   = RateLimiterConfig.custom()
            .limitForPeriod(capacity)
            .limitRefreshPeriod(window)
            .timeoutDuration(Duration.ZERO)
            .build();
        this.limiters = Caffeine.newBuilder()
            .expireAfterAccess(window.toNanos(), TimeUnit.NANOSECONDS)
            .maximumSize(maxClients)
            .ticker(ticker)
            .build();
    }

    /** Cost of a batch request, capped so a single batch can always be admitted by a fresh window. */
    public int batchCost(int marketCount) {
        long cost = (long) BATCH_COST_PER_MARKET * Math.max(1, marketCount);
        return (int) Math.min(capacity, cost);
    }

    /**
     * @throws RateLimitExceededException when the client has fewer than {@code cost} permits left in this window
     */
    public void acquire(String clientKey, int cost) {
        AtomicRateLimiter limiter = limiters.get(clientKey, key -> new AtomicRateLimiter(key, config));
        if (!limiter.acquirePermission(Math.min(cost, capacity))) {
            long retryAfter = retryAfterSeconds(limiter);
            log.warn("[RateLimit] Rejected. client={} cost={} retryAfterSeconds={}", clientKey, cost, retryAfter);
            throw new RateLimitExceededException(clientKey, retryAfter);
        }
    }

    /** Permits {@code clientKey} can still spend in the current window. */
    public int available(String clientKey) {
        AtomicRateLimiter limiter = limiters.getIfPresent(clientKey);
        return limiter == null ? capacity : Math.max(0, limiter.getMetrics().getAvailablePermissions());
    }

    /** Clients currently holding a limiter, after pending evictions are applied. */
    long trackedClients() {
        limiters.cleanUp();
        return limiters.estimatedSize();
    }

    Duration window() {
        return window;
    }

    // Metrics only report the wait for a single permit; when that is zero the window has not rolled yet.
    private long retryAfterSeconds(AtomicRateLimiter limiter) {
        long nanos = limiter.getDetailedMetrics().getNanosToWait();
        if (nanos <= 0) {
            nanos = window.toNanos();
        }
        return Math.max(1L, (long) Math.ceil(nanos / 1_000_000_000.0));
    }
}
