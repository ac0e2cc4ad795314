package com.chicu.causalimpact.web.dto;

import com.chicu.causalimpact.engine.ImpactConfigOverrides;
import com.chicu.causalimpact.series.Period;
import com.chicu.causalimpact.series.RawTable;
import com.chicu.causalimpact.series.TableSchema;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Тело запроса анализа. Строки таблицы приходят как объекты "колонка → значение".
 * <p>
 * Задаётся {@code intervention_timestamp} либо пара {@code pre_period}/{@code post_period}.
 * {@code group_key} можно не указывать, если в таблице одна группа;
 * {@code groups} используется только в /analyze-groups.
 */
public record ImpactAnalyzeRequest(
        String seriesId,
        List<Map<String, Object>> rows,
        String timestampColumn,
        String groupKeyColumn,
        String responseColumn,
        List<String> covariates,
        String groupKey,
        List<String> groups,
        String interventionTimestamp,
        PeriodDto prePeriod,
        PeriodDto postPeriod,
        ImpactConfigOverrides config
) {

    public RawTable toTable() {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("rows are required");
        }
        return RawTable.fromRows(rows);
    }

    public TableSchema toSchema() {
        return TableSchema.builder()
                .timestampColumn(timestampColumn)
                .groupKeyColumn(groupKeyColumn)
                .responseColumn(responseColumn)
                .covariateColumns(covariates)
                .build();
    }

    public Instant interventionAt() {
        return TimeSeriesPreprocessor.parseTimestamp(interventionTimestamp);
    }

    public Period pre() {
        return prePeriod == null ? null : prePeriod.toPeriod();
    }

    public Period post() {
        return postPeriod == null ? null : postPeriod.toPeriod();
    }
}
