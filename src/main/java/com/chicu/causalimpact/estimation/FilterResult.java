package com.chicu.causalimpact.estimation;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Выход прямого прохода фильтра Калмана по pre-периоду (индексы в координатах окна модели).
 *
 * @param predictedStates       a_{t|t-1}
 * @param predictedCovariances  P_{t|t-1}
 * @param filteredStates        a_{t|t}
 * @param filteredCovariances   P_{t|t}
 * @param predictionMeans       одношаговый прогноз отклика E[y_t | y_1..t-1]
 * @param predictionVariances   его дисперсия F_t (с шумом наблюдения)
 * @param logLikelihood         лог-правдоподобие без диффузных шагов
 * @param likelihoodTerms       сколько наблюдений вошло в правдоподобие
 */
public record FilterResult(
        RealVector[] predictedStates,
        RealMatrix[] predictedCovariances,
        RealVector[] filteredStates,
        RealMatrix[] filteredCovariances,
        double[] predictionMeans,
        double[] predictionVariances,
        double logLikelihood,
        int likelihoodTerms
) {

    public int length() {
        return filteredStates.length;
    }

    public RealVector lastFilteredState() {
        return filteredStates[filteredStates.length - 1];
    }

    public RealMatrix lastFilteredCovariance() {
        return filteredCovariances[filteredCovariances.length - 1];
    }
}
