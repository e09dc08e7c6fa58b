package com.nft.market.nft_market.security;

import java.time.Duration;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

/**
 * One resilience4j rate limiter per caller.
 *
 * Limiters idle for longer than the expiry (never less than one refresh
 * period) are dropped, and at most maxCallers are tracked at once.
 */
public class RateLimiterService {

    private final Cache<String, RateLimiter> cache;
    private final RateLimiterConfig config;

    public RateLimiterService(int limitForPeriod, Duration refreshPeriod, Duration idleExpiry, long maxCallers) {
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(refreshPeriod)
                .limitForPeriod(limitForPeriod)
                .timeoutDuration(Duration.ZERO)
                .build();
        Duration expiry = idleExpiry.compareTo(refreshPeriod) < 0 ? refreshPeriod : idleExpiry;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterAccess(expiry)
                .maximumSize(maxCallers)
                .build();
    }

    public boolean allowRequest(String key) {
        RateLimiter rateLimiter = cache.asMap().computeIfAbsent(key, k -> RateLimiter.of("caller-" + k, config));
        return rateLimiter.acquirePermission();
    }

    public long trackedCallers() {
        cache.cleanUp();
        return cache.size();
    }
}
