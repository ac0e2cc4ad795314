package com.chicu.causalimpact.engine.cache;

import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.series.Period;

/**
 * Ключ мемоизации: одинаковые ряд, периоды и параметры дают одинаковый результат.
 */
public record ImpactCacheKey(
        String seriesId,
        String groupKey,
        Period pre,
        Period post,
        ImpactConfig config
) {
}
