package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import com.chicu.causalimpact.series.PreparedSeries;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Всё, что известно после оценки: модель, гиперпараметры, фильтр, сглаживание и план выборки.
 * Живёт в пределах одного анализа.
 *
 * @param prepared           ряд после возможного удаления вырожденных ковариат
 * @param mixture            кандидаты дисперсий с весами; кандидат 0 = hyperparameters
 * @param droppedCovariates  удалённые ковариаты (только при auto-drop)
 * @param warnings           восстановимые проблемы, о которых надо сказать вызывающему
 */
@Builder
public record FittedModel(
        PreparedSeries prepared,
        StructuralTimeSeriesModel model,
        ModelHyperparameters hyperparameters,
        FilterResult filter,
        SmoothedStates smoothed,
        SimulationSmoother.Plan samplingPlan,
        HyperparameterMixture mixture,
        double logLikelihood,
        int evaluations,
        boolean converged,
        List<String> droppedCovariates,
        List<String> warnings
) {

    public FittedModel {
        droppedCovariates = droppedCovariates == null ? List.of() : List.copyOf(droppedCovariates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (mixture == null) mixture = HyperparameterMixture.single(hyperparameters);
    }

    /**
     * Сглаженные коэффициенты регрессии в последней точке pre, в исходных единицах
     * (ед. отклика на ед. ковариаты). Порядок = порядок ковариат.
     */
    public Map<String, Double> coefficients() {
        List<String> names = prepared.series().covariateNames();
        int last = smoothed.length() - 1;
        double yScale = model.scaling().response().scale();

        Map<String, Double> out = new LinkedHashMap<>();
        for (int j = 0; j < names.size(); j++) {
            out.put(names.get(j), smoothed.coefficient(last, j) * yScale / model.scaling().covariate(j).scale());
        }
        return out;
    }
}
