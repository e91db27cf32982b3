package com.airsentinel.service.cache;

import com.airsentinel.core.model.JointSeries;

import java.util.function.Supplier;

public final class NoopQueryCache implements QueryCache {
    @Override
    public JointSeries getOrCompute(CacheKey key, Supplier<JointSeries> loader) {
        return loader.get();
    }

    @Override
    public void invalidateAll() {
    }
}
