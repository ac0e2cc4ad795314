package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.common.error.DegenerateModelException;
import com.chicu.causalimpact.common.error.NonConvergenceException;
import com.chicu.causalimpact.engine.DrawExecutor;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.model.DataScaling;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import com.chicu.causalimpact.random.RandomSourceFactory;
import com.chicu.causalimpact.random.RandomStream;
import com.chicu.causalimpact.series.PreparedSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Подгонка модели к pre-периоду и выборка апостериорных траекторий.
 * <p>
 * Порядок: проверка вырожденности → стандартизация → MLE дисперсий →
 * фильтр + сглаживание при найденных дисперсиях → план симуляционного сглаживания →
 * смесь кандидатов дисперсий (если включена parameter-uncertainty).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PosteriorEstimator {

    private final DesignMatrixInspector inspector;
    private final HyperparameterFitter fitter;
    private final KalmanFilter filter;
    private final KalmanSmoother smoother;
    private final SimulationSmoother simulationSmoother;
    private final HyperparameterSampler hyperparameterSampler;
    private final DrawExecutor drawExecutor;
    private final RandomSourceFactory randomSourceFactory;

    public FittedModel fit(PreparedSeries prepared, ImpactConfig config) {
        List<String> warnings = new ArrayList<>();
        List<String> dropped = List.of();

        // =========================================================
        // вырожденные ковариаты: ошибка или auto-drop
        // =========================================================
        DegeneracyReport report = inspector.inspect(prepared);
        if (report.degenerate()) {
            if (!config.autoDropDegenerate()) {
                throw new DegenerateModelException(report.offendingCovariates(), report.rank(), report.columns());
            }

            dropped = report.offendingCovariates();
            prepared = prepared.withSeries(prepared.series().withoutCovariates(new LinkedHashSet<>(dropped)));

            String msg = "dropped degenerate covariates " + dropped
                    + " (constant or collinear in the pre-period)";
            warnings.add(msg);
            log.warn("⚠️ group={} {}", prepared.series().groupKey(), msg);
        }

        DataScaling scaling = config.standardize()
                ? DataScaling.fit(prepared)
                : DataScaling.identity(prepared.series().covariateCount());

        StructuralTimeSeriesModel model = StructuralTimeSeriesModel.of(prepared, config.regressionMode(), scaling);

        // =========================================================
        // MLE
        // =========================================================
        FitOutcome outcome = fitter.fit(model, config.maxOptimizerEvaluations());
        if (!outcome.converged()) {
            if (!config.allowNonConverged()) {
                throw new NonConvergenceException(outcome.evaluations(), outcome.logLikelihood());
            }
            String msg = "hyperparameter optimisation stopped after " + outcome.evaluations()
                    + " evaluations without converging; using the best estimate found";
            warnings.add(msg);
            log.warn("⚠️ group={} {}", prepared.series().groupKey(), msg);
        }

        FilterResult fr = filter.filter(model, outcome.hyperparameters());
        SmoothedStates smoothed = smoother.smooth(fr, model, outcome.hyperparameters());
        SimulationSmoother.Plan plan = simulationSmoother.prepare(fr, model, outcome.hyperparameters());

        HyperparameterMixture mixture = config.parameterUncertainty()
                ? hyperparameterSampler.sample(model, outcome.hyperparameters(), config.seed())
                : HyperparameterMixture.single(outcome.hyperparameters());
        if (mixture.size() > 1 && mixture.effectiveSize() < 2.0) {
            log.debug("⚠️ group={} variance mixture collapsed to the MLE point (effectiveSize={})",
                    prepared.series().groupKey(), mixture.effectiveSize());
        }

        log.debug("🧮 fitted group={} covariates={} logLik={} evals={} converged={} h={}",
                prepared.series().groupKey(), prepared.series().covariateNames(),
                outcome.logLikelihood(), outcome.evaluations(), outcome.converged(), outcome.hyperparameters());

        return FittedModel.builder()
                .prepared(prepared)
                .model(model)
                .hyperparameters(outcome.hyperparameters())
                .filter(fr)
                .smoothed(smoothed)
                .samplingPlan(plan)
                .mixture(mixture)
                .logLikelihood(outcome.logLikelihood())
                .evaluations(outcome.evaluations())
                .converged(outcome.converged())
                .droppedCovariates(dropped)
                .warnings(warnings)
                .build();
    }

    /**
     * N траекторий состояний; выборка i использует собственный генератор (seed, i),
     * поэтому параллельный расчёт даёт тот же результат, что и последовательный.
     * <p>
     * Сначала для каждой выборки выбирается кандидат дисперсий из смеси, затем
     * для каждого выбранного кандидата один раз готовится план сглаживания.
     */
    public PosteriorEnsemble sample(FittedModel fitted, ImpactConfig config) {
        HyperparameterMixture mixture = fitted.mixture();
        long seed = config.seed();
        int n = config.numDraws();

        int[] picks = new int[n];
        for (int i = 0; i < n; i++) {
            picks[i] = mixture.size() == 1
                    ? 0
                    : mixture.pick(randomSourceFactory.create(seed, RandomStream.MIXTURE, i).nextDouble());
        }

        int[] distinct = Arrays.stream(picks).distinct().sorted().toArray();
        List<SimulationSmoother.Plan> prepared = drawExecutor.map(distinct.length, j -> {
            int c = distinct[j];
            if (c == 0) return fitted.samplingPlan();

            ModelHyperparameters h = mixture.get(c);
            FilterResult fr = filter.filter(fitted.model(), h);
            return simulationSmoother.prepare(fr, fitted.model(), h);
        });

        Map<Integer, SimulationSmoother.Plan> plans = new HashMap<>();
        for (int j = 0; j < distinct.length; j++) plans.put(distinct[j], prepared.get(j));

        List<PosteriorSample> samples = drawExecutor.map(n, i -> {
            RandomGenerator rng = randomSourceFactory.create(seed, RandomStream.SMOOTHING, i);
            return new PosteriorSample(i, mixture.get(picks[i]), plans.get(picks[i]).draw(rng));
        });

        return new PosteriorEnsemble(samples);
    }
}
