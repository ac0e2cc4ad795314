package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.model.RegressionMode;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import lombok.Builder;

/**
 * Параметры одного анализа. Полный набор значений (без null): собирается из
 * {@link com.chicu.causalimpact.config.CausalImpactProperties} и переопределений запроса.
 */
@Builder(toBuilder = true)
public record ImpactConfig(
        double credibleLevel,
        int numDraws,
        long seed,
        boolean autoDropDegenerate,
        int minPrePeriodObservations,
        RegressionMode regressionMode,
        boolean allowNonConverged,
        boolean standardize,
        int maxOptimizerEvaluations,
        int reportPrecision,
        boolean parameterUncertainty
) {

    public static ImpactConfig defaults() {
        return new ImpactConfig(0.95, 1000, 42L, false, 3, RegressionMode.STATIC, false, true, 2000, 2, true);
    }

    /**
     * @throws IllegalArgumentException если значение вне допустимого диапазона
     */
    public ImpactConfig validate(int maxDraws) {
        if (!(credibleLevel > 0.0 && credibleLevel < 1.0)) {
            throw new IllegalArgumentException("credible_level must be in (0, 1), got " + credibleLevel);
        }
        if (numDraws < 1) {
            throw new IllegalArgumentException("num_draws must be >= 1, got " + numDraws);
        }
        if (numDraws > maxDraws) {
            throw new IllegalArgumentException("num_draws " + numDraws + " exceeds the limit " + maxDraws);
        }
        if (minPrePeriodObservations < 1) {
            throw new IllegalArgumentException("min_pre_period_observations must be >= 1, got " + minPrePeriodObservations);
        }
        if (regressionMode == null) {
            throw new IllegalArgumentException("regression mode is null");
        }
        if (maxOptimizerEvaluations < 1) {
            throw new IllegalArgumentException("max_optimizer_evaluations must be >= 1, got " + maxOptimizerEvaluations);
        }
        if (reportPrecision < 0 || reportPrecision > 10) {
            throw new IllegalArgumentException("report_precision must be in [0, 10], got " + reportPrecision);
        }
        return this;
    }

    /** Нижний квантиль интервала, например 0.025 для 95%. */
    public double lowerQuantile() {
        return (1.0 - credibleLevel) / 2.0;
    }

    public double upperQuantile() {
        return 1.0 - lowerQuantile();
    }

    /** max(min_pre_period_observations, 2 × число свободных параметров модели). */
    public int requiredPreObservations(int covariateCount) {
        return Math.max(minPrePeriodObservations,
                2 * StructuralTimeSeriesModel.freeParameters(covariateCount, regressionMode));
    }
}
