package com.chicu.causalimpact.effect;

import lombok.Builder;

import java.time.Instant;

/**
 * Одна строка результата. null означает «для этой точки не определено».
 */
@Builder(toBuilder = true)
public record InferenceRow(
        Instant timestamp,
        Double actual,
        Double predicted,
        Double predictedLower,
        Double predictedUpper,
        Double pointwiseEffect,
        Double pointwiseEffectLower,
        Double pointwiseEffectUpper,
        Double cumulativeEffect,
        Double cumulativeEffectLower,
        Double cumulativeEffectUpper
) {

    public Double get(ResultField field) {
        return switch (field) {
            case ACTUAL -> actual;
            case PREDICTED -> predicted;
            case PREDICTED_LOWER -> predictedLower;
            case PREDICTED_UPPER -> predictedUpper;
            case POINTWISE_EFFECT -> pointwiseEffect;
            case POINTWISE_EFFECT_LOWER -> pointwiseEffectLower;
            case POINTWISE_EFFECT_UPPER -> pointwiseEffectUpper;
            case CUMULATIVE_EFFECT -> cumulativeEffect;
            case CUMULATIVE_EFFECT_LOWER -> cumulativeEffectLower;
            case CUMULATIVE_EFFECT_UPPER -> cumulativeEffectUpper;
        };
    }
}
