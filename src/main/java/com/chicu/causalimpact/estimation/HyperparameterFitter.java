package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.RegressionMode;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.springframework.stereotype.Component;

/**
 * Максимум правдоподобия по log-дисперсиям шумов (Nelder–Mead).
 * <p>
 * Log-параметризация держит дисперсии положительными; ограничения задаются обрезкой
 * theta внутри целевой функции, т.к. симплекс не поддерживает границы.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HyperparameterFitter {

    private static final double REL_TOLERANCE = 1e-8;
    private static final double ABS_TOLERANCE = 1e-10;
    private static final double PENALTY = 1e300;

    /** Верхняя граница дисперсии относительно дисперсии pre-отклика. */
    private static final double MAX_VARIANCE_RATIO = 100.0;

    private final KalmanFilter filter;

    public FitOutcome fit(StructuralTimeSeriesModel model, int maxEvaluations) {
        RegressionMode mode = model.regressionMode();
        double scale = model.observedVariance();

        double lower = lowerBound();
        double upper = upperBound(model);

        double[] start = mode == RegressionMode.DYNAMIC
                ? new double[]{Math.log(0.5 * scale), Math.log(0.05 * scale), Math.log(1e-3)}
                : new double[]{Math.log(0.5 * scale), Math.log(0.05 * scale)};

        BestPoint best = new BestPoint();

        MultivariateFunction negLogLik = theta -> {
            double[] c = clamp(theta, lower, upper);
            double ll = filter.logLikelihood(model, ModelHyperparameters.fromLogVariances(c, mode));
            double value = Double.isFinite(ll) ? -ll : PENALTY;
            best.offer(c, value);
            return value;
        };

        SimplexOptimizer optimizer = new SimplexOptimizer(new SimpleValueChecker(REL_TOLERANCE, ABS_TOLERANCE));

        try {
            PointValuePair p = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new MaxIter(maxEvaluations),
                    new ObjectiveFunction(negLogLik),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new NelderMeadSimplex(start.length, 1.0)
            );

            double[] theta = clamp(p.getPoint(), lower, upper);
            ModelHyperparameters h = ModelHyperparameters.fromLogVariances(theta, mode);

            log.debug("🧮 MLE converged evals={} logLik={} obs={} level={} coef={}",
                    optimizer.getEvaluations(), -p.getValue(),
                    h.observationVariance(), h.levelVariance(), h.coefficientVariance());

            return new FitOutcome(h, -p.getValue(), optimizer.getEvaluations(), true);

        } catch (MaxCountExceededException e) {
            if (best.point == null) {
                // бюджет не позволил даже одно вычисление: берём стартовую точку
                double[] theta = clamp(start, lower, upper);
                return new FitOutcome(ModelHyperparameters.fromLogVariances(theta, mode),
                        Double.NEGATIVE_INFINITY, best.evaluations, false);
            }

            log.debug("🧮 MLE budget exhausted evals={} bestLogLik={}", best.evaluations, -best.value);
            return new FitOutcome(ModelHyperparameters.fromLogVariances(best.point, mode),
                    -best.value, best.evaluations, false);
        }
    }

    /** Нижняя граница log-дисперсии. */
    public static double lowerBound() {
        return Math.log(ModelHyperparameters.VARIANCE_FLOOR);
    }

    /** Верхняя граница log-дисперсии для данной модели. */
    public static double upperBound(StructuralTimeSeriesModel model) {
        return Math.log(MAX_VARIANCE_RATIO * model.observedVariance());
    }

    private static double[] clamp(double[] theta, double lower, double upper) {
        double[] out = new double[theta.length];
        for (int i = 0; i < theta.length; i++) {
            out[i] = Math.max(lower, Math.min(upper, theta[i]));
        }
        return out;
    }

    private static final class BestPoint {
        private double[] point;
        private double value = Double.POSITIVE_INFINITY;
        private int evaluations;

        void offer(double[] p, double v) {
            evaluations++;
            if (v < value) {
                value = v;
                point = p.clone();
            }
        }
    }
}
