package com.airsentinel.service.cache;

import com.airsentinel.core.model.JointSeries;

import java.util.function.Supplier;

public interface QueryCache {
    JointSeries getOrCompute(CacheKey key, Supplier<JointSeries> loader);

    void invalidateAll();
}
