package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.effect.InferenceResult;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.report.ImpactSummary;
import com.chicu.causalimpact.series.Period;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итог анализа одного ряда: таблица по точкам, сводка и диагностика оценки.
 *
 * @param hyperparameters дисперсии модели в исходном масштабе отклика
 * @param coefficients    сглаженные коэффициенты регрессии в конце pre (исходные единицы)
 * @param seed            фактически использованный seed (для групп: base + ordinal)
 */
@Builder(toBuilder = true)
public record ImpactAnalysis(
        String seriesId,
        String groupKey,
        Period pre,
        Period post,
        InferenceResult result,
        ImpactSummary summary,
        ModelHyperparameters hyperparameters,
        Map<String, Double> coefficients,
        double logLikelihood,
        int optimizerEvaluations,
        boolean converged,
        List<String> covariates,
        List<String> droppedCovariates,
        List<String> warnings,
        long seed,
        int numDraws,
        long tookMs
) {

    public ImpactAnalysis {
        covariates = covariates == null ? List.of() : List.copyOf(covariates);
        droppedCovariates = droppedCovariates == null ? List.of() : List.copyOf(droppedCovariates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        coefficients = coefficients == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }
}
