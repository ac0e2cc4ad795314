package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.engine.DrawExecutor;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.RegressionMode;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import com.chicu.causalimpact.random.RandomSourceFactory;
import com.chicu.causalimpact.random.RandomStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Неопределённость дисперсий шумов (sampling-importance-resampling).
 * <p>
 * Кандидаты в log-пространстве берутся из N(theta_mle, SPREAD^2 I) в границах оптимизатора
 * и взвешиваются правдоподобием pre-периода; предложение одновременно служит априорным распределением.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HyperparameterSampler {

    static final int CANDIDATES = 200;
    static final double SPREAD = 1.0;

    private final KalmanFilter filter;
    private final DrawExecutor drawExecutor;
    private final RandomSourceFactory randomSourceFactory;

    public HyperparameterMixture sample(StructuralTimeSeriesModel model, ModelHyperparameters mle, long seed) {
        RegressionMode mode = model.regressionMode();
        double[] center = mle.toLogVariances(mode);
        double lower = HyperparameterFitter.lowerBound();
        double upper = HyperparameterFitter.upperBound(model);

        List<Candidate> candidates = drawExecutor.map(CANDIDATES, c -> {
            if (c == 0) {
                return new Candidate(mle, filter.logLikelihood(model, mle));
            }

            RandomGenerator rng = randomSourceFactory.create(seed, RandomStream.HYPERPARAMETERS, c);
            double[] theta = new double[center.length];
            boolean inside = true;
            for (int i = 0; i < theta.length; i++) {
                theta[i] = center[i] + SPREAD * rng.nextGaussian();
                if (theta[i] < lower || theta[i] > upper) inside = false;
            }

            ModelHyperparameters h = ModelHyperparameters.fromLogVariances(theta, mode);
            // вне границ априорная плотность равна нулю
            double ll = inside ? filter.logLikelihood(model, h) : Double.NEGATIVE_INFINITY;
            return new Candidate(h, ll);
        });

        double max = Double.NEGATIVE_INFINITY;
        for (Candidate c : candidates) {
            if (Double.isFinite(c.logLikelihood())) max = Math.max(max, c.logLikelihood());
        }
        if (max == Double.NEGATIVE_INFINITY) {
            log.warn("⚠️ no finite likelihood among variance candidates, using the MLE point only");
            return HyperparameterMixture.single(mle);
        }

        List<ModelHyperparameters> values = new ArrayList<>(candidates.size());
        double[] weights = new double[candidates.size()];
        double total = 0.0;
        for (int c = 0; c < candidates.size(); c++) {
            Candidate cand = candidates.get(c);
            values.add(cand.hyperparameters());
            double ll = cand.logLikelihood();
            weights[c] = Double.isFinite(ll) ? Math.exp(ll - max) : 0.0;
            total += weights[c];
        }

        double sumSq = 0.0;
        for (int c = 0; c < weights.length; c++) {
            weights[c] /= total;
            sumSq += weights[c] * weights[c];
        }
        double ess = 1.0 / sumSq;

        log.debug("🧮 variance mixture candidates={} effectiveSize={}", weights.length, ess);
        return new HyperparameterMixture(values, weights, ess);
    }

    private record Candidate(ModelHyperparameters hyperparameters, double logLikelihood) {
    }
}
