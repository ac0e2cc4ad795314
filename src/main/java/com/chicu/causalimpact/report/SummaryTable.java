package com.chicu.causalimpact.report;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Сводка по post-периоду: метрика × (average | cumulative).
 * null - значение не определено (например, относительный эффект при нулевом прогнозе).
 */
public final class SummaryTable {

    private final Map<SummaryMetric, Map<SummaryColumn, Double>> cells;

    private SummaryTable(Map<SummaryMetric, Map<SummaryColumn, Double>> cells) {
        this.cells = cells;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Double get(SummaryMetric metric, SummaryColumn column) {
        Map<SummaryColumn, Double> row = cells.get(metric);
        return row == null ? null : row.get(column);
    }

    /** Вид для JSON: {"abs_effect": {"average": .., "cumulative": ..}, ...}. */
    public Map<String, Map<String, Double>> asKeyedMap() {
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        for (SummaryMetric m : SummaryMetric.values()) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (SummaryColumn c : SummaryColumn.values()) {
                row.put(c.key(), get(m, c));
            }
            out.put(m.key(), row);
        }
        return Collections.unmodifiableMap(out);
    }

    /** Та же таблица, округлённая для показа. */
    public SummaryTable rounded(int precision) {
        Builder b = builder();
        for (SummaryMetric m : SummaryMetric.values()) {
            boolean fraction = m == SummaryMetric.REL_EFFECT
                    || m == SummaryMetric.REL_EFFECT_LOWER
                    || m == SummaryMetric.REL_EFFECT_UPPER;
            for (SummaryColumn c : SummaryColumn.values()) {
                b.put(m, c, Rounding.round(get(m, c), fraction ? precision + 2 : precision));
            }
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SummaryTable t && cells.equals(t.cells));
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "SummaryTable" + asKeyedMap();
    }

    public static final class Builder {
        private final Map<SummaryMetric, Map<SummaryColumn, Double>> cells = new EnumMap<>(SummaryMetric.class);

        public Builder put(SummaryMetric metric, SummaryColumn column, Double value) {
            cells.computeIfAbsent(metric, m -> new EnumMap<>(SummaryColumn.class)).put(column, value);
            return this;
        }

        public SummaryTable build() {
            Map<SummaryMetric, Map<SummaryColumn, Double>> copy = new EnumMap<>(SummaryMetric.class);
            cells.forEach((m, row) -> copy.put(m, Collections.unmodifiableMap(new EnumMap<>(row))));
            return new SummaryTable(Collections.unmodifiableMap(copy));
        }
    }
}
