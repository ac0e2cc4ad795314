package com.chicu.causalimpact.engine;

import lombok.Builder;

/**
 * Переопределения параметров из запроса. null = взять значение из {@code causalimpact.*}.
 */
@Builder
public record ImpactConfigOverrides(
        Double credibleLevel,
        Integer numDraws,
        Long seed,
        Boolean autoDropDegenerate,
        Integer minPrePeriodObservations,
        Boolean dynamicRegression,
        Boolean allowNonConverged,
        Boolean standardize,
        Integer maxOptimizerEvaluations,
        Integer reportPrecision,
        Boolean parameterUncertainty
) {

    public static ImpactConfigOverrides none() {
        return ImpactConfigOverrides.builder().build();
    }
}
