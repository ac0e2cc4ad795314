package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Матрица регрессоров pre-периода вырождена: ковариата константна или линейно зависима.
 */
@Getter
public class DegenerateModelException extends CausalImpactException {

    private final List<String> offendingCovariates;

    public DegenerateModelException(List<String> offendingCovariates, int rank, int columns) {
        super(PipelineStage.ESTIMATION,
                "pre-period design matrix is rank-deficient (rank " + rank + " of " + columns
                        + "), offending covariates: " + offendingCovariates
                        + "; set auto_drop_degenerate=true to drop them",
                Map.of("offendingCovariates", List.copyOf(offendingCovariates),
                        "rank", rank,
                        "columns", columns));
        this.offendingCovariates = List.copyOf(offendingCovariates);
    }

    @Override
    public String getCode() {
        return "DEGENERATE_MODEL";
    }
}
