package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.series.Period;
import com.chicu.causalimpact.series.TimeSeries;
import lombok.Builder;

import java.time.Instant;

/**
 * Запрос на анализ одного ряда.
 * Задаётся либо момент вмешательства, либо пара явных периодов pre/post.
 *
 * @param seriesId       идентификатор для кэша; null → без кэширования
 * @param interventionAt первый момент post; pre = всё, что строго раньше
 * @param config         полный набор параметров (null → значения по умолчанию)
 */
@Builder(toBuilder = true)
public record ImpactRequest(
        String seriesId,
        TimeSeries series,
        Instant interventionAt,
        Period pre,
        Period post,
        ImpactConfig config
) {

    public boolean hasExplicitPeriods() {
        return pre != null || post != null;
    }
}
