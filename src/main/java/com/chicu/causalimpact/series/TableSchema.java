package com.chicu.causalimpact.series;

import lombok.Builder;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Какие колонки таблицы что означают.
 */
@Builder(toBuilder = true)
public record TableSchema(
        String timestampColumn,
        String groupKeyColumn,
        String responseColumn,
        List<String> covariateColumns
) {

    public static final String DEFAULT_TIMESTAMP = "timestamp";
    public static final String DEFAULT_GROUP_KEY = "group_key";
    public static final String DEFAULT_RESPONSE = "response";

    public TableSchema {
        timestampColumn = blankToDefault(timestampColumn, DEFAULT_TIMESTAMP);
        groupKeyColumn = blankToDefault(groupKeyColumn, DEFAULT_GROUP_KEY);
        responseColumn = blankToDefault(responseColumn, DEFAULT_RESPONSE);
        covariateColumns = List.copyOf(covariateColumns == null ? List.of() : covariateColumns);
    }

    public static TableSchema withCovariates(List<String> covariates) {
        return TableSchema.builder().covariateColumns(covariates).build();
    }

    public Set<String> requiredColumns() {
        Set<String> out = new LinkedHashSet<>();
        out.add(timestampColumn);
        out.add(groupKeyColumn);
        out.add(responseColumn);
        out.addAll(covariateColumns);
        return out;
    }

    private static String blankToDefault(String v, String def) {
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
