package com.chicu.causalimpact.engine.cache;

import com.chicu.causalimpact.engine.ImpactAnalysis;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * LRU-кэш в памяти процесса с ограничением на число записей.
 */
@Slf4j
public class InMemoryImpactCache implements ImpactCache {

    private final int maxEntries;
    private final Map<ImpactCacheKey, ImpactAnalysis> entries;

    public InMemoryImpactCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("cache maxEntries must be >= 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ImpactCacheKey, ImpactAnalysis> eldest) {
                return size() > InMemoryImpactCache.this.maxEntries;
            }
        };
    }

    @Override
    public synchronized Optional<ImpactAnalysis> get(ImpactCacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(ImpactCacheKey key, ImpactAnalysis analysis) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(analysis, "analysis");
        entries.put(key, analysis);
    }

    @Override
    public synchronized int invalidate(String seriesId) {
        int removed = 0;
        Iterator<ImpactCacheKey> it = entries.keySet().iterator();
        while (it.hasNext()) {
            if (Objects.equals(it.next().seriesId(), seriesId)) {
                it.remove();
                removed++;
            }
        }
        log.debug("🧹 cache invalidate seriesId={} removed={}", seriesId, removed);
        return removed;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }
}
