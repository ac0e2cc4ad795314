package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.config.CausalImpactProperties;
import com.chicu.causalimpact.model.RegressionMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Свести настройки приложения и переопределения запроса в один проверенный {@link ImpactConfig}.
 */
@Component
@RequiredArgsConstructor
public class ImpactConfigResolver {

    private final CausalImpactProperties props;

    public ImpactConfig defaults() {
        return resolve(null);
    }

    /**
     * @throws IllegalArgumentException если итоговое значение недопустимо
     */
    public ImpactConfig resolve(ImpactConfigOverrides o) {
        ImpactConfigOverrides ov = o == null ? ImpactConfigOverrides.none() : o;

        boolean dynamic = pick(ov.dynamicRegression(), props.isDynamicRegression());

        ImpactConfig cfg = ImpactConfig.builder()
                .credibleLevel(pick(ov.credibleLevel(), props.getCredibleLevel()))
                .numDraws(pick(ov.numDraws(), props.getNumDraws()))
                .seed(pick(ov.seed(), props.getSeed()))
                .autoDropDegenerate(pick(ov.autoDropDegenerate(), props.isAutoDropDegenerate()))
                .minPrePeriodObservations(pick(ov.minPrePeriodObservations(), props.getMinPrePeriodObservations()))
                .regressionMode(dynamic ? RegressionMode.DYNAMIC : RegressionMode.STATIC)
                .allowNonConverged(pick(ov.allowNonConverged(), props.isAllowNonConverged()))
                .standardize(pick(ov.standardize(), props.isStandardize()))
                .maxOptimizerEvaluations(pick(ov.maxOptimizerEvaluations(), props.getMaxOptimizerEvaluations()))
                .reportPrecision(pick(ov.reportPrecision(), props.getReportPrecision()))
                .parameterUncertainty(pick(ov.parameterUncertainty(), props.isParameterUncertainty()))
                .build();

        return validate(cfg);
    }

    public ImpactConfig validate(ImpactConfig cfg) {
        return cfg.validate(props.getMaxDraws());
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }
}
