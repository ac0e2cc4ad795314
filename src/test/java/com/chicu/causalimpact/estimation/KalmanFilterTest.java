package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.DataScaling;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.RegressionMode;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import com.chicu.causalimpact.series.Observation;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.support.SyntheticSeries;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KalmanFilterTest {

    private final KalmanFilter filter = new KalmanFilter();
    private final KalmanSmoother smoother = new KalmanSmoother();
    private final TimeSeriesPreprocessor preprocessor = new TimeSeriesPreprocessor();

    private StructuralTimeSeriesModel localLevel(Double... values) {
        List<Observation> obs = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            obs.add(new Observation(SyntheticSeries.day(i), values[i], new double[0]));
        }
        // последняя точка уходит в post
        obs.add(new Observation(SyntheticSeries.day(values.length), 0.0, new double[0]));
        TimeSeries s = new TimeSeries("A", List.of(), obs);
        PreparedSeries p = preprocessor.splitAtIntervention(s, SyntheticSeries.day(values.length), 1);
        return StructuralTimeSeriesModel.of(p, RegressionMode.STATIC, DataScaling.identity(0));
    }

    @Test
    void localLevelMatchesScalarRecursion() {
        StructuralTimeSeriesModel model = localLevel(1.0, 1.4, 0.9, 1.7, 2.2, 2.0);
        ModelHyperparameters h = new ModelHyperparameters(0.3, 0.1, 0.0);

        FilterResult fr = filter.filter(model, h);

        double a = model.initialState().getEntry(0);
        double p = model.initialCovariance().getEntry(0, 0);
        double ll = 0;
        for (int t = 0; t < model.fitLength(); t++) {
            if (t > 0) p += h.levelVariance();
            double f = p + h.observationVariance();
            double v = model.response(t) - a;

            assertEquals(a, fr.predictionMeans()[t], 1e-9);
            assertEquals(f, fr.predictionVariances()[t], 1e-6 * f);

            if (t >= 1) {
                ll += -0.5 * (Math.log(2 * Math.PI) + Math.log(f) + v * v / f);
            }
            double k = p / f;
            a += k * v;
            p = p * h.observationVariance() / f;

            assertEquals(a, fr.filteredStates()[t].getEntry(0), 1e-9);
            assertEquals(p, fr.filteredCovariances()[t].getEntry(0, 0), 1e-9);
        }

        // первое (диффузное) наблюдение в правдоподобие не входит
        assertEquals(model.fitLength() - 1, fr.likelihoodTerms());
        assertEquals(ll, fr.logLikelihood(), 1e-9);
    }

    @Test
    void missingPreResponseSkipsUpdate() {
        StructuralTimeSeriesModel model = localLevel(1.0, 2.0, null, 3.0);
        ModelHyperparameters h = new ModelHyperparameters(0.5, 0.2, 0.0);

        FilterResult fr = filter.filter(model, h);

        assertEquals(fr.predictedStates()[2].getEntry(0), fr.filteredStates()[2].getEntry(0), 0.0);
        assertEquals(fr.predictedCovariances()[2].getEntry(0, 0), fr.filteredCovariances()[2].getEntry(0, 0), 0.0);
        assertEquals(2, fr.likelihoodTerms());
    }

    @Test
    void smoothedVarianceNeverExceedsFiltered() {
        Well19937c rng = new Well19937c(11);
        Double[] y = new Double[40];
        double level = 0;
        for (int i = 0; i < y.length; i++) {
            level += 0.3 * rng.nextGaussian();
            y[i] = level + rng.nextGaussian();
        }
        StructuralTimeSeriesModel model = localLevel(y);
        ModelHyperparameters h = new ModelHyperparameters(1.0, 0.09, 0.0);

        FilterResult fr = filter.filter(model, h);
        SmoothedStates s = smoother.smooth(fr, model, h);

        int m = fr.length();
        assertEquals(fr.lastFilteredState().getEntry(0), s.level(m - 1), 0.0);
        for (int t = 0; t < m; t++) {
            assertTrue(s.levelVariance(t) <= fr.filteredCovariances()[t].getEntry(0, 0) + 1e-12, "t=" + t);
            assertTrue(s.levelVariance(t) > 0, "t=" + t);
        }
    }

    @Test
    void simulationSmootherDrawsCentreOnSmoothedMeans() {
        Well19937c gen = new Well19937c(5);
        Double[] y = new Double[30];
        for (int i = 0; i < y.length; i++) y[i] = 10 + gen.nextGaussian();
        StructuralTimeSeriesModel model = localLevel(y);
        ModelHyperparameters h = new ModelHyperparameters(1.0, 0.05, 0.0);

        FilterResult fr = filter.filter(model, h);
        SmoothedStates s = smoother.smooth(fr, model, h);
        SimulationSmoother.Plan plan = new SimulationSmoother().prepare(fr, model, h);

        int n = 4000;
        int m = plan.length();
        double[] sum = new double[m];
        Well19937c rng = new Well19937c(99);
        for (int d = 0; d < n; d++) {
            double[][] draw = plan.draw(rng);
            for (int t = 0; t < m; t++) sum[t] += draw[t][0];
        }

        for (int t = 0; t < m; t++) {
            double se = Math.sqrt(s.levelVariance(t) / n);
            assertEquals(s.level(t), sum[t] / n, 5 * se, "t=" + t);
        }
    }
}
