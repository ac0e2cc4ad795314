package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.config.CausalImpactProperties;
import com.chicu.causalimpact.model.RegressionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImpactConfigResolverTest {

    private CausalImpactProperties props;
    private ImpactConfigResolver resolver;

    @BeforeEach
    void setUp() {
        props = new CausalImpactProperties();
        props.setNumDraws(500);
        props.setSeed(7L);
        props.setMaxDraws(5_000);
        resolver = new ImpactConfigResolver(props);
    }

    @Test
    void defaultsComeFromProperties() {
        ImpactConfig cfg = resolver.defaults();

        assertEquals(0.95, cfg.credibleLevel());
        assertEquals(500, cfg.numDraws());
        assertEquals(7L, cfg.seed());
        assertEquals(RegressionMode.STATIC, cfg.regressionMode());
        assertTrue(cfg.parameterUncertainty());
        assertEquals(0.025, cfg.lowerQuantile(), 1e-12);
        assertEquals(0.975, cfg.upperQuantile(), 1e-12);
    }

    @Test
    void overridesWinOverProperties() {
        ImpactConfig cfg = resolver.resolve(ImpactConfigOverrides.builder()
                .credibleLevel(0.9)
                .numDraws(200)
                .seed(99L)
                .dynamicRegression(true)
                .autoDropDegenerate(true)
                .reportPrecision(4)
                .parameterUncertainty(false)
                .build());

        assertEquals(0.9, cfg.credibleLevel());
        assertEquals(200, cfg.numDraws());
        assertEquals(99L, cfg.seed());
        assertEquals(RegressionMode.DYNAMIC, cfg.regressionMode());
        assertTrue(cfg.autoDropDegenerate());
        assertEquals(4, cfg.reportPrecision());
        assertFalse(cfg.parameterUncertainty());
        // не переопределено
        assertEquals(props.getMaxOptimizerEvaluations(), cfg.maxOptimizerEvaluations());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(ImpactConfigOverrides.builder().credibleLevel(0.0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(ImpactConfigOverrides.builder().credibleLevel(1.5).build()));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(ImpactConfigOverrides.builder().numDraws(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(ImpactConfigOverrides.builder().numDraws(5_001).build()));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(ImpactConfigOverrides.builder().reportPrecision(-1).build()));
    }

    @Test
    void requiredPreObservationsGrowWithModelSize() {
        ImpactConfig cfg = resolver.defaults();

        // уровень + 2 дисперсии
        assertEquals(6, cfg.requiredPreObservations(0));
        // + 3 коэффициента
        assertEquals(12, cfg.requiredPreObservations(3));
        // динамическая регрессия добавляет дисперсию коэффициентов
        assertEquals(14, cfg.toBuilder().regressionMode(RegressionMode.DYNAMIC).build().requiredPreObservations(3));
        assertEquals(20, cfg.toBuilder().minPrePeriodObservations(20).build().requiredPreObservations(0));
    }
}
