package com.chicu.causalimpact.prediction;

import com.chicu.causalimpact.engine.DrawExecutor;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.estimation.FilterResult;
import com.chicu.causalimpact.estimation.FittedModel;
import com.chicu.causalimpact.estimation.PosteriorEnsemble;
import com.chicu.causalimpact.estimation.PosteriorSample;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.RegressionMode;
import com.chicu.causalimpact.model.Scaling;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import com.chicu.causalimpact.random.RandomSourceFactory;
import com.chicu.causalimpact.random.RandomStream;
import com.chicu.causalimpact.series.PreparedSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Прогон каждой апостериорной траектории вперёд через post-период без вмешательства.
 * Ковариаты post считаются незатронутыми и используются как есть.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterfactualPredictor {

    private final DrawExecutor drawExecutor;
    private final RandomSourceFactory randomSourceFactory;

    public CounterfactualDraws predict(FittedModel fitted, PosteriorEnsemble ensemble, ImpactConfig config) {
        PreparedSeries prepared = fitted.prepared();
        StructuralTimeSeriesModel model = fitted.model();
        Scaling y = model.scaling().response();

        // ---------------------------------------------------------------------
        // pre: одношаговые прогнозы фильтра (не прогон вперёд)
        // ---------------------------------------------------------------------
        FilterResult fr = fitted.filter();
        int m = fr.length();
        double[] preMeans = new double[m];
        double[] preSd = new double[m];
        for (int t = 0; t < m; t++) {
            preMeans[t] = y.restore(fr.predictionMeans()[t]);
            preSd[t] = y.restoreSpread(Math.sqrt(fr.predictionVariances()[t]));
        }

        // ---------------------------------------------------------------------
        // post (и возможный разрыв между pre и post): прогон выборок вперёд
        // ---------------------------------------------------------------------
        int horizon = model.length() - model.fitLength();
        int forecastStart = prepared.preEndIndex() + 1;

        boolean dynamic = model.regressionMode() == RegressionMode.DYNAMIC;
        int k = model.covariateCount();
        long seed = config.seed();

        List<double[]> paths = drawExecutor.map(ensemble.size(), d -> {
            PosteriorSample sample = ensemble.get(d);
            RandomGenerator rng = randomSourceFactory.create(seed, RandomStream.FORECAST, sample.drawIndex());

            // дисперсии той же выборки, при которых получена траектория
            ModelHyperparameters h = sample.hyperparameters();
            double levelSd = Math.sqrt(h.levelVariance());
            double obsSd = Math.sqrt(h.observationVariance());
            double coefSd = dynamic ? Math.sqrt(h.coefficientVariance()) : 0.0;

            double[] state = sample.finalState();
            double[] out = new double[horizon];

            for (int step = 0; step < horizon; step++) {
                int t = model.fitLength() + step;

                state[0] += levelSd * rng.nextGaussian();
                if (coefSd > 0) {
                    for (int j = 1; j <= k; j++) state[j] += coefSd * rng.nextGaussian();
                }

                double signal = model.signal(new ArrayRealVector(state, false), t);
                out[step] = y.restore(signal + obsSd * rng.nextGaussian());
            }
            return out;
        });

        double[][] draws = paths.toArray(new double[0][]);

        log.debug("🔮 counterfactual group={} draws={} horizon={} forecastStart={}",
                prepared.series().groupKey(), draws.length, horizon, forecastStart);

        return new CounterfactualDraws(prepared.preStartIndex(), preMeans, preSd, forecastStart, draws);
    }
}
