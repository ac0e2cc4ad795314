package com.chicu.causalimpact.effect;

/**
 * Колонки таблицы результата. Ключи совпадают с именами полей во внешнем JSON.
 */
public enum ResultField {
    /** Наблюдённый отклик. */
    ACTUAL("actual"),
    /** Контрфактический прогноз (среднее по выборкам; в pre - одношаговый прогноз фильтра). */
    PREDICTED("predicted"),
    PREDICTED_LOWER("predicted_lower"),
    PREDICTED_UPPER("predicted_upper"),
    /** actual − predicted, усреднённое по выборкам. */
    POINTWISE_EFFECT("pointwise_effect"),
    POINTWISE_EFFECT_LOWER("pointwise_effect_lower"),
    POINTWISE_EFFECT_UPPER("pointwise_effect_upper"),
    /** Накопленный эффект с начала post; вне post всегда null. */
    CUMULATIVE_EFFECT("cumulative_effect"),
    CUMULATIVE_EFFECT_LOWER("cumulative_effect_lower"),
    CUMULATIVE_EFFECT_UPPER("cumulative_effect_upper");

    private final String key;

    ResultField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
