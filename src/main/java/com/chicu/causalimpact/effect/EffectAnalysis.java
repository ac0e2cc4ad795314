package com.chicu.causalimpact.effect;

/**
 * Таблица результата вместе с выборками эффектов, из которых она сведена.
 */
public record EffectAnalysis(InferenceResult result, EffectDraws draws) {
}
