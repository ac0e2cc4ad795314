package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.series.Observation;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.support.SyntheticSeries;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DesignMatrixInspectorTest {

    private final DesignMatrixInspector inspector = new DesignMatrixInspector();
    private final TimeSeriesPreprocessor preprocessor = new TimeSeriesPreprocessor();

    /**
     * x1 - шум, x2 = 2*x1 + 3, x3 - константа (только в pre), x4 - независимый шум.
     */
    private PreparedSeries series() {
        Well19937c rng = new Well19937c(3);
        List<Observation> obs = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            double x1 = rng.nextGaussian();
            double x3 = i < 20 ? 7.0 : 7.0 + i;
            double x4 = rng.nextGaussian();
            obs.add(new Observation(SyntheticSeries.day(i), rng.nextGaussian(),
                    new double[]{x1, 2 * x1 + 3, x3, x4}));
        }
        TimeSeries s = new TimeSeries("A", List.of("x1", "x2", "x3", "x4"), obs);
        return preprocessor.splitAtIntervention(s, SyntheticSeries.day(20), 3);
    }

    @Test
    void constantAndCollinearCovariatesAreNamed() {
        DegeneracyReport report = inspector.inspect(series());

        assertTrue(report.degenerate());
        assertEquals(List.of("x2", "x3"), report.offendingCovariates());
        assertEquals(3, report.rank());
        assertEquals(5, report.columns());
    }

    @Test
    void independentCovariatesPass() {
        PreparedSeries p = series();
        PreparedSeries clean = p.withSeries(p.series().withoutCovariates(Set.of("x2", "x3")));

        DegeneracyReport report = inspector.inspect(clean);

        assertFalse(report.degenerate());
        assertEquals(3, report.rank());
    }

    @Test
    void noCovariatesIsNeverDegenerate() {
        PreparedSeries p = preprocessor.splitAtIntervention(
                SyntheticSeries.step(10, 5, 1.0, 1.0), SyntheticSeries.week(5), 3);

        assertFalse(inspector.inspect(p).degenerate());
    }
}
