package com.chicu.causalimpact.effect;

/**
 * Эффекты по каждой выборке на post-периоде (до сведения в среднее/квантили).
 *
 * @param postStartIndex     индекс ряда первой точки post
 * @param pointwise          pointwise[d][p]: actual − prediction выборки d в точке post p
 * @param cumulative         cumulative[d][p]: накопленная сумма pointwise[d][0..p]
 * @param averageActual      среднее наблюдённое значение на post
 * @param averagePrediction  averagePrediction[d]: средний прогноз выборки d на post
 * @param averageEffect      averageEffect[d]: средний эффект выборки d на post
 * @param relativeEffect     relativeEffect[d] = averageEffect[d] / averagePrediction[d]; NaN, если знаменатель ~0
 */
public record EffectDraws(
        int postStartIndex,
        double[][] pointwise,
        double[][] cumulative,
        double averageActual,
        double[] averagePrediction,
        double[] averageEffect,
        double[] relativeEffect
) {

    public int drawCount() {
        return pointwise.length;
    }

    public int postLength() {
        return pointwise.length == 0 ? 0 : pointwise[0].length;
    }

    /** Суммарный эффект выборки d за весь post. */
    public double totalEffect(int d) {
        return cumulative[d][cumulative[d].length - 1];
    }

    public double[] totalEffects() {
        double[] out = new double[drawCount()];
        for (int d = 0; d < out.length; d++) out[d] = totalEffect(d);
        return out;
    }

    /**
     * true, если хоть одна выборка дала неопределённый относительный эффект
     * или средний прогноз меняет знак между выборками (отношение тогда не монотонно по прогнозу).
     */
    public boolean relativeEffectUndefined() {
        for (double r : relativeEffect) {
            if (Double.isNaN(r)) return true;
        }
        return counterfactualChangesSign();
    }

    public boolean counterfactualChangesSign() {
        boolean negative = false;
        boolean positive = false;
        for (double p : averagePrediction) {
            if (p < 0) negative = true;
            if (p > 0) positive = true;
        }
        return negative && positive;
    }
}
