package com.chicu.causalimpact.effect;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.jetbrains.annotations.Contract;

/**
 * Среднее и квантильный интервал по выборкам.
 * Границы поджимаются так, чтобы lower ≤ mean ≤ upper выполнялось всегда.
 */
public record IntervalEstimate(double mean, double lower, double upper) {

    public static IntervalEstimate of(double[] values, double lowerQuantile, double upperQuantile) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("no draws to summarise");
        }

        double mean = StatUtils.mean(values);
        if (values.length == 1) {
            return new IntervalEstimate(mean, mean, mean);
        }

        // R-7: та же оценка квантиля, что и в numpy/R по умолчанию
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        double lo = percentile.evaluate(lowerQuantile * 100.0);
        double hi = percentile.evaluate(upperQuantile * 100.0);

        return new IntervalEstimate(mean, Math.min(lo, mean), Math.max(hi, mean));
    }

    @Contract(pure = true)
    public boolean excludesZero() {
        return lower > 0 || upper < 0;
    }
}
