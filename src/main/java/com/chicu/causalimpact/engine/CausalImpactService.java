package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.effect.EffectAggregator;
import com.chicu.causalimpact.effect.EffectAnalysis;
import com.chicu.causalimpact.engine.cache.ImpactCache;
import com.chicu.causalimpact.engine.cache.ImpactCacheKey;
import com.chicu.causalimpact.estimation.FittedModel;
import com.chicu.causalimpact.estimation.PosteriorEnsemble;
import com.chicu.causalimpact.estimation.PosteriorEstimator;
import com.chicu.causalimpact.prediction.CounterfactualDraws;
import com.chicu.causalimpact.prediction.CounterfactualPredictor;
import com.chicu.causalimpact.report.ImpactSummary;
import com.chicu.causalimpact.report.SummaryReporter;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Весь конвейер для одного ряда:
 * периоды → оценка модели → выборки → контрфактический прогноз → эффекты → сводка.
 * <p>
 * Состояния между вызовами нет; повторное использование результатов только через {@link ImpactCache}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CausalImpactService {

    private final TimeSeriesPreprocessor preprocessor;
    private final PosteriorEstimator estimator;
    private final CounterfactualPredictor predictor;
    private final EffectAggregator aggregator;
    private final SummaryReporter reporter;
    private final ImpactConfigResolver configResolver;
    private final ImpactCache cache;

    public ImpactAnalysis analyze(ImpactRequest request) {
        if (request == null || request.series() == null) {
            throw new IllegalArgumentException("request with a time series is required");
        }

        ImpactConfig config = request.config() == null
                ? configResolver.defaults()
                : configResolver.validate(request.config());

        TimeSeries series = request.series();
        PreparedSeries prepared = prepare(request, config);

        // ==========================
        // кэш
        // ==========================
        ImpactCacheKey key = request.seriesId() == null ? null
                : new ImpactCacheKey(request.seriesId(), series.groupKey(), prepared.pre(), prepared.post(), config);

        if (key != null) {
            Optional<ImpactAnalysis> hit = cache.get(key);
            if (hit.isPresent()) {
                log.info("♻️ IMPACT CACHE HIT seriesId={} group={} pre={} post={}",
                        request.seriesId(), series.groupKey(), prepared.pre(), prepared.post());
                return hit.get();
            }
        }

        long started = System.currentTimeMillis();

        log.info("🧠 IMPACT START seriesId={} group={} points={} covariates={} pre={} post={} draws={} seed={} mode={}",
                safe(request.seriesId()), series.groupKey(), series.size(), series.covariateNames(),
                prepared.pre(), prepared.post(), config.numDraws(), config.seed(), config.regressionMode());

        FittedModel fitted = estimator.fit(prepared, config);
        PosteriorEnsemble ensemble = estimator.sample(fitted, config);
        CounterfactualDraws cf = predictor.predict(fitted, ensemble, config);
        EffectAnalysis effects = aggregator.aggregate(fitted.prepared(), cf, config);
        ImpactSummary summary = reporter.summarize(effects.draws(), config);

        List<String> warnings = new ArrayList<>(fitted.warnings());
        if (!summary.relativeEffectDefined()) {
            warnings.add("relative effect is undefined: the counterfactual mean is zero or changes sign across draws");
        }

        long took = System.currentTimeMillis() - started;

        ImpactAnalysis analysis = ImpactAnalysis.builder()
                .seriesId(request.seriesId())
                .groupKey(series.groupKey())
                .pre(prepared.pre())
                .post(prepared.post())
                .result(effects.result())
                .summary(summary)
                .hyperparameters(fitted.hyperparameters().rescaled(fitted.model().scaling().response().scale()))
                .coefficients(fitted.coefficients())
                .logLikelihood(fitted.logLikelihood())
                .optimizerEvaluations(fitted.evaluations())
                .converged(fitted.converged())
                .covariates(fitted.prepared().series().covariateNames())
                .droppedCovariates(fitted.droppedCovariates())
                .warnings(warnings)
                .seed(config.seed())
                .numDraws(config.numDraws())
                .tookMs(took)
                .build();

        log.info("✅ IMPACT DONE seriesId={} group={} avgEffect={} relEffect={} significant={} converged={} warnings={} tookMs={}",
                safe(request.seriesId()), series.groupKey(), summary.averageEffect(), summary.relativeEffect(),
                summary.significant(), fitted.converged(), warnings.size(), took);

        if (key != null) {
            cache.put(key, analysis);
        }
        return analysis;
    }

    /**
     * Сбросить все закэшированные анализы ряда (в том числе по группам).
     */
    public int invalidate(String seriesId) {
        int removed = cache.invalidate(seriesId);
        log.info("🧹 IMPACT CACHE INVALIDATE seriesId={} removed={}", seriesId, removed);
        return removed;
    }

    // =========================================================
    // helpers
    // =========================================================

    private PreparedSeries prepare(ImpactRequest request, ImpactConfig config) {
        TimeSeries series = request.series();
        int minPre = config.requiredPreObservations(series.covariateCount());

        if (request.hasExplicitPeriods()) {
            if (request.interventionAt() != null) {
                throw new IllegalArgumentException("give either an intervention timestamp or explicit periods, not both");
            }
            if (request.pre() == null || request.post() == null) {
                throw new IllegalArgumentException("both pre and post periods are required");
            }
            return preprocessor.validatePeriods(series, request.pre(), request.post(), minPre);
        }

        if (request.interventionAt() == null) {
            throw new IllegalArgumentException("intervention timestamp is required");
        }
        return preprocessor.splitAtIntervention(series, request.interventionAt(), minPre);
    }

    private static String safe(String s) {
        if (s == null) return "-";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }
}
