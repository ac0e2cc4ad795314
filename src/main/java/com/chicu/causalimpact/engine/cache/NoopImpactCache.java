package com.chicu.causalimpact.engine.cache;

import com.chicu.causalimpact.engine.ImpactAnalysis;

import java.util.Optional;

/**
 * Кэш выключен ({@code causalimpact.cache.enabled=false}): ничего не хранит.
 */
public class NoopImpactCache implements ImpactCache {

    @Override
    public Optional<ImpactAnalysis> get(ImpactCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(ImpactCacheKey key, ImpactAnalysis analysis) {
        // no-op
    }

    @Override
    public int invalidate(String seriesId) {
        return 0;
    }

    @Override
    public int size() {
        return 0;
    }
}
