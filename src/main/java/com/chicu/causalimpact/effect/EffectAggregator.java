package com.chicu.causalimpact.effect;

import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.prediction.CounterfactualDraws;
import com.chicu.causalimpact.series.Observation;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Эффекты считаются по каждой выборке и только потом сводятся в среднее и квантили.
 * Квантили не аддитивны: интервал накопленного эффекта берётся по накопленным суммам выборок,
 * а не суммированием поточечных квантилей.
 */
@Slf4j
@Service
public class EffectAggregator {

    public EffectAnalysis aggregate(PreparedSeries prepared, CounterfactualDraws cf, ImpactConfig config) {
        TimeSeries series = prepared.series();
        double qLo = config.lowerQuantile();
        double qHi = config.upperQuantile();
        double z = new NormalDistribution(null, 0.0, 1.0).inverseCumulativeProbability(qHi);

        EffectDraws draws = computeDraws(prepared, cf);

        List<InferenceRow> rows = new ArrayList<>(series.size());

        for (int i = 0; i < series.size(); i++) {
            Observation o = series.get(i);
            Double actual = o.hasResponse() ? o.response() : null;

            InferenceRow.InferenceRowBuilder row = InferenceRow.builder()
                    .timestamp(o.timestamp())
                    .actual(actual);

            if (prepared.isPre(i)) {
                // pre: одношаговый прогноз фильтра, гауссовы границы
                int t = i - cf.preStartIndex();
                double mean = cf.preMeans()[t];
                double half = z * cf.preStdDevs()[t];

                row.predicted(mean)
                        .predictedLower(mean - half)
                        .predictedUpper(mean + half);

                if (actual != null) {
                    row.pointwiseEffect(actual - mean)
                            .pointwiseEffectLower(actual - (mean + half))
                            .pointwiseEffectUpper(actual - (mean - half));
                }

            } else if (cf.isForecast(i)) {
                IntervalEstimate pred = IntervalEstimate.of(cf.predictionsAt(i), qLo, qHi);
                row.predicted(pred.mean())
                        .predictedLower(pred.lower())
                        .predictedUpper(pred.upper());

                if (prepared.isPost(i)) {
                    int p = i - prepared.postStartIndex();
                    IntervalEstimate point = IntervalEstimate.of(column(draws.pointwise(), p), qLo, qHi);
                    IntervalEstimate cum = IntervalEstimate.of(column(draws.cumulative(), p), qLo, qHi);

                    row.pointwiseEffect(point.mean())
                            .pointwiseEffectLower(point.lower())
                            .pointwiseEffectUpper(point.upper())
                            .cumulativeEffect(cum.mean())
                            .cumulativeEffectLower(cum.lower())
                            .cumulativeEffectUpper(cum.upper());

                } else if (actual != null) {
                    // разрыв между pre и post: эффект есть, накопления нет
                    double[] preds = cf.predictionsAt(i);
                    double[] eff = new double[preds.length];
                    for (int d = 0; d < preds.length; d++) eff[d] = actual - preds[d];
                    IntervalEstimate point = IntervalEstimate.of(eff, qLo, qHi);

                    row.pointwiseEffect(point.mean())
                            .pointwiseEffectLower(point.lower())
                            .pointwiseEffectUpper(point.upper());
                }
            }

            rows.add(row.build());
        }

        log.debug("📊 effects group={} rows={} draws={} postLength={}",
                series.groupKey(), rows.size(), draws.drawCount(), draws.postLength());

        return new EffectAnalysis(new InferenceResult(rows), draws);
    }

    /**
     * Поточечные и накопленные эффекты каждой выборки на post + относительный эффект выборки.
     */
    EffectDraws computeDraws(PreparedSeries prepared, CounterfactualDraws cf) {
        TimeSeries series = prepared.series();
        int n = cf.drawCount();
        int len = prepared.postLength();
        int start = prepared.postStartIndex();

        double[] actual = new double[len];
        double actualSum = 0;
        for (int p = 0; p < len; p++) {
            actual[p] = series.get(start + p).response();
            actualSum += actual[p];
        }

        double[][] pointwise = new double[n][len];
        double[][] cumulative = new double[n][len];
        double[] avgPred = new double[n];
        double[] avgEffect = new double[n];
        double[] relative = new double[n];

        for (int d = 0; d < n; d++) {
            double running = 0;
            double predSum = 0;
            for (int p = 0; p < len; p++) {
                double pred = cf.prediction(d, start + p);
                double e = actual[p] - pred;
                pointwise[d][p] = e;
                running += e;
                cumulative[d][p] = running;
                predSum += pred;
            }
            avgPred[d] = predSum / len;
            avgEffect[d] = running / len;
            relative[d] = Math.abs(avgPred[d]) < ModelHyperparameters.VARIANCE_FLOOR
                    ? Double.NaN
                    : avgEffect[d] / avgPred[d];
        }

        return new EffectDraws(start, pointwise, cumulative, actualSum / len, avgPred, avgEffect, relative);
    }

    private static double[] column(double[][] m, int col) {
        double[] out = new double[m.length];
        for (int d = 0; d < m.length; d++) out[d] = m[d][col];
        return out;
    }
}
