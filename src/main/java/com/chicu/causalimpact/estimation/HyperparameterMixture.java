package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;

import java.util.Arrays;
import java.util.List;

/**
 * Дискретное приближение апостериорного распределения дисперсий.
 * Кандидат 0 всегда MLE-точка.
 *
 * @param candidates    значения дисперсий
 * @param weights       нормированные веса (сумма = 1)
 * @param effectiveSize эффективный размер выборки 1 / sum(w^2)
 */
public record HyperparameterMixture(
        List<ModelHyperparameters> candidates,
        double[] weights,
        double effectiveSize
) {

    public HyperparameterMixture {
        candidates = List.copyOf(candidates);
        if (candidates.isEmpty() || candidates.size() != weights.length) {
            throw new IllegalArgumentException("candidates and weights must be non-empty and of equal size");
        }
        weights = weights.clone();
    }

    /** Одна точка с весом 1: дисперсии считаются известными. */
    public static HyperparameterMixture single(ModelHyperparameters h) {
        return new HyperparameterMixture(List.of(h), new double[]{1.0}, 1.0);
    }

    public int size() {
        return candidates.size();
    }

    public ModelHyperparameters get(int index) {
        return candidates.get(index);
    }

    /**
     * Номер кандидата для равномерного u из [0, 1).
     */
    public int pick(double u) {
        double acc = 0.0;
        for (int i = 0; i < weights.length; i++) {
            acc += weights[i];
            if (u < acc) return i;
        }
        // хвост из-за округления суммы весов
        for (int i = weights.length - 1; i >= 0; i--) {
            if (weights[i] > 0) return i;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof HyperparameterMixture m
                && candidates.equals(m.candidates)
                && Arrays.equals(weights, m.weights));
    }

    @Override
    public int hashCode() {
        return 31 * candidates.hashCode() + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "HyperparameterMixture[candidates=" + candidates.size() + ", effectiveSize=" + effectiveSize + "]";
    }
}
