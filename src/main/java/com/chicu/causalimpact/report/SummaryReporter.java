package com.chicu.causalimpact.report;

import com.chicu.causalimpact.effect.EffectDraws;
import com.chicu.causalimpact.effect.IntervalEstimate;
import com.chicu.causalimpact.engine.ImpactConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Сведение выборок эффекта в скалярную сводку, таблицу и текст.
 * Все числа считаются в полной точности; округление только в тексте и в {@link ImpactSummary#rounded()}.
 */
@Slf4j
@Service
public class SummaryReporter {

    public ImpactSummary summarize(EffectDraws draws, ImpactConfig config) {
        double qLo = config.lowerQuantile();
        double qHi = config.upperQuantile();
        int len = draws.postLength();

        IntervalEstimate avgPred = IntervalEstimate.of(draws.averagePrediction(), qLo, qHi);
        IntervalEstimate avgEffect = IntervalEstimate.of(draws.averageEffect(), qLo, qHi);
        IntervalEstimate cumEffect = IntervalEstimate.of(draws.totalEffects(), qLo, qHi);

        boolean relUndefined = draws.relativeEffectUndefined();
        IntervalEstimate rel = relUndefined ? null : IntervalEstimate.of(draws.relativeEffect(), qLo, qHi);

        // ---------------------------------------------------------------------
        // хвостовая вероятность по знаку суммарного эффекта
        // ---------------------------------------------------------------------
        double[] totals = draws.totalEffects();
        int nonPositive = 0;
        int nonNegative = 0;
        for (double t : totals) {
            if (t <= 0) nonPositive++;
            if (t >= 0) nonNegative++;
        }
        double tail = Math.min(nonPositive, nonNegative) / (double) totals.length;

        boolean significant = rel != null ? rel.excludesZero() : avgEffect.excludesZero();

        SummaryTable table = buildTable(draws, avgPred, avgEffect, cumEffect, rel, len, qLo, qHi);

        Texts texts = new Texts(config.reportPrecision(), config.credibleLevel());
        String narrative = texts.narrative(draws.averageActual(), avgPred, avgEffect, rel, 1.0 - tail, significant);
        String report = texts.report(draws.averageActual(), len, avgPred, avgEffect, cumEffect, rel, tail, significant);

        if (relUndefined) {
            log.warn("⚠️ relative effect undefined: counterfactual mean is ~0 or changes sign across draws");
        }

        return ImpactSummary.builder()
                .averageEffect(avgEffect.mean())
                .averageEffectLower(avgEffect.lower())
                .averageEffectUpper(avgEffect.upper())
                .relativeEffect(rel == null ? null : rel.mean())
                .relativeEffectLower(rel == null ? null : rel.lower())
                .relativeEffectUpper(rel == null ? null : rel.upper())
                .cumulativeEffect(cumEffect.mean())
                .cumulativeEffectLower(cumEffect.lower())
                .cumulativeEffectUpper(cumEffect.upper())
                .credibleLevel(config.credibleLevel())
                .significant(significant)
                .posteriorTailProbability(tail)
                .probabilityOfCausalEffect(1.0 - tail)
                .narrativeText(narrative)
                .reportText(report)
                .table(table)
                .precision(config.reportPrecision())
                .build();
    }

    private static SummaryTable buildTable(EffectDraws draws,
                                           IntervalEstimate avgPred,
                                           IntervalEstimate avgEffect,
                                           IntervalEstimate cumEffect,
                                           IntervalEstimate rel,
                                           int len,
                                           double qLo,
                                           double qHi) {
        double[] sumPred = draws.averagePrediction().clone();
        for (int d = 0; d < sumPred.length; d++) sumPred[d] *= len;
        IntervalEstimate cumPred = IntervalEstimate.of(sumPred, qLo, qHi);

        SummaryTable.Builder b = SummaryTable.builder()
                .put(SummaryMetric.ACTUAL, SummaryColumn.AVERAGE, draws.averageActual())
                .put(SummaryMetric.ACTUAL, SummaryColumn.CUMULATIVE, draws.averageActual() * len)
                .put(SummaryMetric.PREDICTED, SummaryColumn.AVERAGE, avgPred.mean())
                .put(SummaryMetric.PREDICTED, SummaryColumn.CUMULATIVE, cumPred.mean())
                .put(SummaryMetric.PREDICTED_LOWER, SummaryColumn.AVERAGE, avgPred.lower())
                .put(SummaryMetric.PREDICTED_LOWER, SummaryColumn.CUMULATIVE, cumPred.lower())
                .put(SummaryMetric.PREDICTED_UPPER, SummaryColumn.AVERAGE, avgPred.upper())
                .put(SummaryMetric.PREDICTED_UPPER, SummaryColumn.CUMULATIVE, cumPred.upper())
                .put(SummaryMetric.ABS_EFFECT, SummaryColumn.AVERAGE, avgEffect.mean())
                .put(SummaryMetric.ABS_EFFECT, SummaryColumn.CUMULATIVE, cumEffect.mean())
                .put(SummaryMetric.ABS_EFFECT_LOWER, SummaryColumn.AVERAGE, avgEffect.lower())
                .put(SummaryMetric.ABS_EFFECT_LOWER, SummaryColumn.CUMULATIVE, cumEffect.lower())
                .put(SummaryMetric.ABS_EFFECT_UPPER, SummaryColumn.AVERAGE, avgEffect.upper())
                .put(SummaryMetric.ABS_EFFECT_UPPER, SummaryColumn.CUMULATIVE, cumEffect.upper());

        // сумма эффекта / сумма прогноза = среднее / среднее: колонки совпадают
        for (SummaryColumn c : SummaryColumn.values()) {
            b.put(SummaryMetric.REL_EFFECT, c, rel == null ? null : rel.mean());
            b.put(SummaryMetric.REL_EFFECT_LOWER, c, rel == null ? null : rel.lower());
            b.put(SummaryMetric.REL_EFFECT_UPPER, c, rel == null ? null : rel.upper());
        }
        return b.build();
    }

    // =========================================================
    // texts
    // =========================================================

    private record Texts(int precision, double level) {

        String narrative(double actual,
                         IntervalEstimate pred,
                         IntervalEstimate effect,
                         IntervalEstimate rel,
                         double probability,
                         boolean significant) {
            StringBuilder sb = new StringBuilder();
            sb.append("During the post-period the response averaged ").append(num(actual))
                    .append(" against a counterfactual of ").append(num(pred.mean())).append(". ");

            if (rel != null) {
                sb.append("The intervention caused a relative change of ").append(pct(rel.mean()))
                        .append(" (").append(lvl()).append(" interval ").append(pct(rel.lower()))
                        .append(" to ").append(pct(rel.upper())).append(")");
            } else {
                sb.append("The intervention caused an average change of ").append(signed(effect.mean()))
                        .append(" (").append(lvl()).append(" interval ").append(signed(effect.lower()))
                        .append(" to ").append(signed(effect.upper())).append(")");
            }

            sb.append(", with ").append(prob(probability))
                    .append(" posterior probability that the effect is non-zero. ");

            if (significant) {
                sb.append("The credible interval excludes zero, so the effect is statistically significant.");
            } else {
                sb.append("The credible interval includes zero, so the effect is not statistically significant.");
            }
            return sb.toString();
        }

        String report(double actual,
                      int len,
                      IntervalEstimate pred,
                      IntervalEstimate effect,
                      IntervalEstimate cum,
                      IntervalEstimate rel,
                      double tail,
                      boolean significant) {
            StringBuilder sb = new StringBuilder("Analysis report\n\n");

            sb.append("During the post-intervention period the response averaged ").append(num(actual))
                    .append(". Had the intervention not taken place, it would have been expected to average ")
                    .append(num(pred.mean())).append(" (").append(lvl()).append(" interval ")
                    .append(num(pred.lower())).append(" to ").append(num(pred.upper()))
                    .append("). Subtracting the counterfactual from the observed values gives an average effect of ")
                    .append(signed(effect.mean())).append(" (").append(lvl()).append(" interval ")
                    .append(signed(effect.lower())).append(" to ").append(signed(effect.upper())).append(").\n\n");

            sb.append("Summed over the ").append(len).append(" post-period points, the response totalled ")
                    .append(num(actual * len)).append(", an overall effect of ").append(signed(cum.mean()))
                    .append(" (").append(lvl()).append(" interval ").append(signed(cum.lower()))
                    .append(" to ").append(signed(cum.upper())).append(").\n\n");

            if (rel != null) {
                sb.append("In relative terms the response changed by ").append(pct(rel.mean()))
                        .append(" (").append(lvl()).append(" interval ").append(pct(rel.lower()))
                        .append(" to ").append(pct(rel.upper())).append(").\n\n");
            } else {
                sb.append("The relative effect is undefined because the counterfactual level is zero or changes sign.\n\n");
            }

            if (significant && effect.mean() >= 0) {
                sb.append("The interval lies entirely above zero: the increase is unlikely to be explained ")
                        .append("by the dynamics of the pre-period alone.\n\n");
            } else if (significant) {
                sb.append("The interval lies entirely below zero: the decrease is unlikely to be explained ")
                        .append("by the dynamics of the pre-period alone.\n\n");
            } else {
                sb.append("The interval includes zero, so the data do not rule out that the intervention had ")
                        .append("no effect. The apparent change may be noise, or the post-period may be too short ")
                        .append("for the noise level of the series.\n\n");
            }

            sb.append("The posterior probability of an effect of the opposite sign is ").append(prob(tail))
                    .append(", so the probability of a causal effect is ").append(prob(1.0 - tail))
                    .append(". This is a Bayesian tail-area probability, not a classical p-value.\n\n");

            sb.append("These conclusions assume that the covariates were not affected by the intervention ")
                    .append("and that their relationship with the response held from the pre-period into the post-period.");
            return sb.toString();
        }

        private String lvl() {
            return String.format(Locale.ROOT, "%.0f%%", level * 100.0);
        }

        private String num(double v) {
            return String.format(Locale.ROOT, "%,." + precision + "f", v);
        }

        private String signed(double v) {
            return String.format(Locale.ROOT, "%+,." + precision + "f", v);
        }

        private String pct(double fraction) {
            return String.format(Locale.ROOT, "%+." + precision + "f%%", fraction * 100.0);
        }

        private String prob(double p) {
            return String.format(Locale.ROOT, "%." + precision + "f%%", p * 100.0);
        }
    }
}
