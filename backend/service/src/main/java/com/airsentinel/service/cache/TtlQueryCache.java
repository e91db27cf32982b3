package com.airsentinel.service.cache;

import com.airsentinel.core.model.JointSeries;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

public final class TtlQueryCache implements QueryCache {
    private static final Logger LOGGER = Logger.getLogger(TtlQueryCache.class.getName());

    private final Cache<CacheKey, JointSeries> cache;

    public TtlQueryCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl is required");
        Objects.requireNonNull(clock, "clock is required");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public JointSeries getOrCompute(CacheKey key, Supplier<JointSeries> loader) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(loader, "loader is required");
        return cache.get(key, k -> {
            LOGGER.fine(() -> "Cache miss for " + k);
            return Objects.requireNonNull(loader.get(), "loader returned null");
        });
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
