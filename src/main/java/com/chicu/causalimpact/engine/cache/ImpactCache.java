package com.chicu.causalimpact.engine.cache;

import com.chicu.causalimpact.engine.ImpactAnalysis;

import java.util.Optional;

/**
 * Явный кэш готовых анализов. Сбрасывается только вызывающим ({@link #invalidate(String)}),
 * поэтому при изменении данных ряда его seriesId нужно инвалидировать.
 */
public interface ImpactCache {

    Optional<ImpactAnalysis> get(ImpactCacheKey key);

    void put(ImpactCacheKey key, ImpactAnalysis analysis);

    /**
     * @return сколько записей удалено
     */
    int invalidate(String seriesId);

    int size();
}
