package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;

/**
 * Итог оценки гиперпараметров методом максимального правдоподобия.
 */
public record FitOutcome(
        ModelHyperparameters hyperparameters,
        double logLikelihood,
        int evaluations,
        boolean converged
) {
}
