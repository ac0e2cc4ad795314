package com.chicu.causalimpact.model;

import lombok.Builder;

/**
 * Дисперсии шумов модели. Все значения ограничены снизу VARIANCE_FLOOR,
 * чтобы нулевая дисперсия не приводила к делению на ноль дальше по конвейеру.
 */
@Builder
public record ModelHyperparameters(
        double observationVariance,
        double levelVariance,
        double coefficientVariance
) {

    public static final double VARIANCE_FLOOR = 1e-8;

    public ModelHyperparameters {
        observationVariance = floor(observationVariance, "observationVariance");
        levelVariance = floor(levelVariance, "levelVariance");
        coefficientVariance = floor(coefficientVariance, "coefficientVariance");
    }

    public static int count(RegressionMode mode) {
        return mode == RegressionMode.DYNAMIC ? 3 : 2;
    }

    /**
     * theta = log-дисперсии в порядке (obs, level[, coef]).
     */
    public static ModelHyperparameters fromLogVariances(double[] theta, RegressionMode mode) {
        double coef = mode == RegressionMode.DYNAMIC ? Math.exp(theta[2]) : VARIANCE_FLOOR;
        return new ModelHyperparameters(Math.exp(theta[0]), Math.exp(theta[1]), coef);
    }

    public double[] toLogVariances(RegressionMode mode) {
        if (mode == RegressionMode.DYNAMIC) {
            return new double[]{Math.log(observationVariance), Math.log(levelVariance), Math.log(coefficientVariance)};
        }
        return new double[]{Math.log(observationVariance), Math.log(levelVariance)};
    }

    /**
     * Дисперсии obs/level в исходных единицах отклика (scale^2).
     * Дисперсия коэффициентов остаётся в стандартизованных единицах.
     */
    public ModelHyperparameters rescaled(double scale) {
        double s2 = scale * scale;
        return new ModelHyperparameters(observationVariance * s2, levelVariance * s2, coefficientVariance);
    }

    private static double floor(double v, String name) {
        if (Double.isNaN(v) || v < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number, got " + v);
        }
        return Math.max(v, VARIANCE_FLOOR);
    }
}
