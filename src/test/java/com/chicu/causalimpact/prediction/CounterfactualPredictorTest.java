package com.chicu.causalimpact.prediction;

import com.chicu.causalimpact.engine.DrawExecutor;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.estimation.FittedModel;
import com.chicu.causalimpact.estimation.PosteriorEnsemble;
import com.chicu.causalimpact.estimation.PosteriorEstimator;
import com.chicu.causalimpact.random.Well19937cRandomSourceFactory;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.support.Pipelines;
import com.chicu.causalimpact.support.SyntheticSeries;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CounterfactualPredictorTest {

    private final TimeSeriesPreprocessor preprocessor = new TimeSeriesPreprocessor();

    private CounterfactualDraws run(int threads, PreparedSeries prepared, ImpactConfig cfg) {
        DrawExecutor executor = new DrawExecutor(Pipelines.properties(threads));
        try {
            PosteriorEstimator estimator = Pipelines.estimator(executor);
            FittedModel fitted = estimator.fit(prepared, cfg);
            PosteriorEnsemble ensemble = estimator.sample(fitted, cfg);
            return new CounterfactualPredictor(executor, new Well19937cRandomSourceFactory())
                    .predict(fitted, ensemble, cfg);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void forecastFollowsCovariatesWithoutTheShift() {
        PreparedSeries prepared = preprocessor.splitAtIntervention(
                SyntheticSeries.regression(4L, 90, 60, 10.0, 2.0, 0.5, 25.0), SyntheticSeries.day(60), 3);
        ImpactConfig cfg = ImpactConfig.defaults().toBuilder().numDraws(300).build();

        CounterfactualDraws cf = run(2, prepared, cfg);

        assertEquals(300, cf.drawCount());
        assertEquals(30, cf.forecastLength());
        assertEquals(60, cf.forecastStartIndex());
        assertEquals(60, cf.preMeans().length);

        // прогноз не видит сдвиг +25: ошибка относительно y - 25 мала
        for (int i = 60; i < 90; i++) {
            double expected = prepared.series().get(i).response() - 25.0;
            assertEquals(expected, StatUtils.mean(cf.predictionsAt(i)), 2.5, "i=" + i);
        }
    }

    @Test
    void drawsDoNotDependOnThreadCount() {
        PreparedSeries prepared = preprocessor.splitAtIntervention(
                SyntheticSeries.regression(8L, 50, 40, 5.0, 1.0, 1.0, 0.0), SyntheticSeries.day(40), 3);
        ImpactConfig cfg = ImpactConfig.defaults().toBuilder().numDraws(200).seed(9L).build();

        CounterfactualDraws single = run(1, prepared, cfg);
        CounterfactualDraws pooled = run(4, prepared, cfg);

        for (int d = 0; d < single.drawCount(); d++) {
            assertArrayEquals(single.draws()[d], pooled.draws()[d], 0.0, "draw " + d);
        }
        assertArrayEquals(single.preMeans(), pooled.preMeans(), 0.0);
    }

    @Test
    void preRowsCarryFilterPredictionsOnTheOriginalScale() {
        PreparedSeries prepared = preprocessor.splitAtIntervention(
                SyntheticSeries.step(40, 30, 100.0, 150.0), SyntheticSeries.week(30), 3);

        CounterfactualDraws cf = run(2, prepared, ImpactConfig.defaults().toBuilder().numDraws(100).build());

        assertEquals(100.0, cf.preMeans()[10], 1e-3);
        assertTrue(cf.preStdDevs()[10] >= 0);
        assertEquals(100.0, StatUtils.mean(cf.predictionsAt(35)), 0.05);
    }
}
