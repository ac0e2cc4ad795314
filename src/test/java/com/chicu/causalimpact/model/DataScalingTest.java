package com.chicu.causalimpact.model;

import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.support.SyntheticSeries;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataScalingTest {

    private final TimeSeriesPreprocessor preprocessor = new TimeSeriesPreprocessor();

    @Test
    void constantPrePeriodFallsBackToUnitScale() {
        PreparedSeries p = preprocessor.splitAtIntervention(
                SyntheticSeries.step(20, 10, 100.0, 150.0), SyntheticSeries.week(10), 3);

        DataScaling scaling = DataScaling.fit(p);

        assertEquals(100.0, scaling.response().mean(), 1e-12);
        assertEquals(1.0, scaling.response().scale(), 0.0);
        assertEquals(50.0, scaling.response().apply(150.0), 1e-12);
    }

    @Test
    void scalingUsesOnlyThePrePeriod() {
        PreparedSeries p = preprocessor.splitAtIntervention(
                SyntheticSeries.regression(7L, 40, 30, 10.0, 2.0, 0.5, 1000.0), SyntheticSeries.day(30), 3);

        DataScaling scaling = DataScaling.fit(p);

        // сдвиг post на 1000 не должен попасть в среднее
        assertTrue(scaling.response().mean() < 200.0);
        double v = 123.4;
        assertEquals(v, scaling.response().restore(scaling.response().apply(v)), 1e-9);
    }

    @Test
    void hyperparametersAreFloored() {
        ModelHyperparameters h = new ModelHyperparameters(0.0, 1e-12, 2.0);

        assertEquals(ModelHyperparameters.VARIANCE_FLOOR, h.observationVariance());
        assertEquals(ModelHyperparameters.VARIANCE_FLOOR, h.levelVariance());
        assertEquals(2.0, h.coefficientVariance());
        assertThrows(IllegalArgumentException.class, () -> new ModelHyperparameters(-1.0, 1.0, 1.0));
    }

    @Test
    void freeParametersCountStateAndVariances() {
        assertEquals(3, StructuralTimeSeriesModel.freeParameters(0, RegressionMode.STATIC));
        assertEquals(5, StructuralTimeSeriesModel.freeParameters(2, RegressionMode.STATIC));
        assertEquals(6, StructuralTimeSeriesModel.freeParameters(2, RegressionMode.DYNAMIC));
    }

    @Test
    void postResponseIsHiddenFromTheModel() {
        PreparedSeries p = preprocessor.splitAtIntervention(
                SyntheticSeries.step(20, 10, 100.0, 150.0), SyntheticSeries.week(10), 3);

        StructuralTimeSeriesModel m = StructuralTimeSeriesModel.of(p, RegressionMode.STATIC, DataScaling.fit(p));

        assertEquals(20, m.length());
        assertEquals(10, m.fitLength());
        assertTrue(m.isObserved(9));
        assertFalse(m.isObserved(10));
        assertTrue(Double.isNaN(m.response(15)));
    }
}
