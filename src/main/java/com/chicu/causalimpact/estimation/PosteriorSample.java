package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;

/**
 * Одна апостериорная траектория состояний pre-периода.
 *
 * @param drawIndex       номер выборки (определяет её генератор случайных чисел)
 * @param hyperparameters дисперсии, при которых получена траектория (стандартизованные единицы)
 * @param states          states[t][j]: t - точка pre, j - компонента состояния (0 = уровень)
 */
public record PosteriorSample(int drawIndex, ModelHyperparameters hyperparameters, double[][] states) {

    public int length() {
        return states.length;
    }

    public double level(int t) {
        return states[t][0];
    }

    public double[] finalState() {
        return states[states.length - 1].clone();
    }
}
