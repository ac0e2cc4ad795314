package com.chicu.causalimpact.report;

/**
 * Колонки сводной таблицы: среднее по post и сумма по post.
 */
public enum SummaryColumn {
    AVERAGE("average"),
    CUMULATIVE("cumulative");

    private final String key;

    SummaryColumn(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
