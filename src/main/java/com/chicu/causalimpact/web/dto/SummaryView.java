package com.chicu.causalimpact.web.dto;

import com.chicu.causalimpact.report.ImpactSummary;

/**
 * Сводка для JSON в полной точности; округлённая таблица лежит рядом в ответе.
 */
public record SummaryView(
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
        String reportText
) {

    public static SummaryView from(ImpactSummary s) {
        return new SummaryView(
                s.averageEffect(),
                s.averageEffectLower(),
                s.averageEffectUpper(),
                s.relativeEffect(),
                s.relativeEffectLower(),
                s.relativeEffectUpper(),
                s.cumulativeEffect(),
                s.cumulativeEffectLower(),
                s.cumulativeEffectUpper(),
                s.credibleLevel(),
                s.significant(),
                s.posteriorTailProbability(),
                s.probabilityOfCausalEffect(),
                s.narrativeText(),
                s.reportText()
        );
    }
}
