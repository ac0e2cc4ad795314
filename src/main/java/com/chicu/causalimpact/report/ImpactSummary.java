package com.chicu.causalimpact.report;

import lombok.Builder;

/**
 * Сводка по post-периоду.
 * <p>
 * {@code posteriorTailProbability} - апостериорная вероятность того, что суммарный эффект
 * имеет противоположный наблюдаемому знак (или равен нулю). Это не p-value классического теста.
 * {@code probabilityOfCausalEffect} = 1 − posteriorTailProbability.
 *
 * @param relativeEffect  доля (0.5 = +50%); null, если контрфактический уровень ~0
 * @param significant     интервал (относительного, а если он не определён - абсолютного) эффекта не содержит 0
 * @param precision       знаков после запятой для {@link #rounded()}
 */
@Builder(toBuilder = true)
public record ImpactSummary(
        double averageEffect,
        double averageEffectLower,
        double averageEffectUpper,
        Double relativeEffect,
        Double relativeEffectLower,
        Double relativeEffectUpper,
        double cumulativeEffect,
        double cumulativeEffectLower,
        double cumulativeEffectUpper,
        double credibleLevel,
        boolean significant,
        double posteriorTailProbability,
        double probabilityOfCausalEffect,
        String narrativeText,
        String reportText,
        SummaryTable table,
        int precision
) {

    /**
     * Копия для показа: абсолютные величины округлены до precision знаков,
     * относительные (доли) - до precision знаков в процентах.
     */
    public ImpactSummary rounded() {
        int p = precision;
        return toBuilder()
                .averageEffect(Rounding.round(averageEffect, p))
                .averageEffectLower(Rounding.round(averageEffectLower, p))
                .averageEffectUpper(Rounding.round(averageEffectUpper, p))
                .relativeEffect(Rounding.round(relativeEffect, p + 2))
                .relativeEffectLower(Rounding.round(relativeEffectLower, p + 2))
                .relativeEffectUpper(Rounding.round(relativeEffectUpper, p + 2))
                .cumulativeEffect(Rounding.round(cumulativeEffect, p))
                .cumulativeEffectLower(Rounding.round(cumulativeEffectLower, p))
                .cumulativeEffectUpper(Rounding.round(cumulativeEffectUpper, p))
                .posteriorTailProbability(Rounding.round(posteriorTailProbability, p + 2))
                .probabilityOfCausalEffect(Rounding.round(probabilityOfCausalEffect, p + 2))
                .table(table == null ? null : table.rounded(p))
                .build();
    }

    public boolean relativeEffectDefined() {
        return relativeEffect != null;
    }
}
