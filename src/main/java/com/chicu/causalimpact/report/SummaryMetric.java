package com.chicu.causalimpact.report;

/**
 * Строки сводной таблицы.
 */
public enum SummaryMetric {
    ACTUAL("actual"),
    PREDICTED("predicted"),
    PREDICTED_LOWER("predicted_lower"),
    PREDICTED_UPPER("predicted_upper"),
    ABS_EFFECT("abs_effect"),
    ABS_EFFECT_LOWER("abs_effect_lower"),
    ABS_EFFECT_UPPER("abs_effect_upper"),
    /** Доля (0.5 = +50%). */
    REL_EFFECT("rel_effect"),
    REL_EFFECT_LOWER("rel_effect_lower"),
    REL_EFFECT_UPPER("rel_effect_upper");

    private final String key;

    SummaryMetric(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
