package com.chicu.causalimpact.prediction;

/**
 * Контрфактические траектории в исходных единицах отклика.
 *
 * @param preStartIndex      индекс ряда первой точки pre
 * @param preMeans           одношаговые прогнозы фильтра для pre (по точкам pre)
 * @param preStdDevs         их стандартные отклонения (с шумом наблюдения)
 * @param forecastStartIndex индекс ряда первой прогнозной точки (сразу после pre)
 * @param draws              draws[d][h]: выборка d, точка forecastStartIndex + h
 */
public record CounterfactualDraws(
        int preStartIndex,
        double[] preMeans,
        double[] preStdDevs,
        int forecastStartIndex,
        double[][] draws
) {

    public int drawCount() {
        return draws.length;
    }

    public int forecastLength() {
        return draws.length == 0 ? 0 : draws[0].length;
    }

    public boolean isForecast(int seriesIndex) {
        return seriesIndex >= forecastStartIndex && seriesIndex < forecastStartIndex + forecastLength();
    }

    public double prediction(int draw, int seriesIndex) {
        return draws[draw][seriesIndex - forecastStartIndex];
    }

    /** Все выборки прогноза в одной точке ряда. */
    public double[] predictionsAt(int seriesIndex) {
        int h = seriesIndex - forecastStartIndex;
        double[] out = new double[draws.length];
        for (int d = 0; d < draws.length; d++) out[d] = draws[d][h];
        return out;
    }
}
