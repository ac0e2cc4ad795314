package com.chicu.causalimpact.engine.group;

import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.series.Period;
import com.chicu.causalimpact.series.RawTable;
import com.chicu.causalimpact.series.TableSchema;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Анализ нескольких групп (рынков) одной таблицы с общими периодами и параметрами.
 *
 * @param groups пусто/null → все группы таблицы в порядке первого появления
 * @param config базовый seed берётся отсюда; группа i получает seed + i
 */
@Builder(toBuilder = true)
public record GroupImpactRequest(
        String seriesId,
        RawTable table,
        TableSchema schema,
        List<String> groups,
        Instant interventionAt,
        Period pre,
        Period post,
        ImpactConfig config
) {
}
