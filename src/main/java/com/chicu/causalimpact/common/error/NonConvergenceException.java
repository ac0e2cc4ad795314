package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;
import lombok.Getter;

import java.util.Map;

/**
 * Оптимизатор гиперпараметров исчерпал бюджет вычислений.
 */
@Getter
public class NonConvergenceException extends CausalImpactException {

    private final int evaluations;
    private final double bestLogLikelihood;

    public NonConvergenceException(int evaluations, double bestLogLikelihood) {
        super(PipelineStage.ESTIMATION,
                "hyperparameter optimisation did not converge within " + evaluations
                        + " evaluations (best log-likelihood " + bestLogLikelihood
                        + "); set allow_non_converged=true to accept the best estimate",
                Map.of("evaluations", evaluations,
                        "bestLogLikelihood", bestLogLikelihood));
        this.evaluations = evaluations;
        this.bestLogLikelihood = bestLogLikelihood;
    }

    @Override
    public String getCode() {
        return "NON_CONVERGENCE";
    }
}
