package com.chicu.causalimpact.estimation;

import java.util.List;

/**
 * Упорядоченный по drawIndex набор выборок.
 */
public record PosteriorEnsemble(List<PosteriorSample> samples) {

    public PosteriorEnsemble {
        samples = List.copyOf(samples);
        for (int i = 0; i < samples.size(); i++) {
            if (samples.get(i).drawIndex() != i) {
                throw new IllegalArgumentException("samples must be ordered by draw index, got "
                        + samples.get(i).drawIndex() + " at position " + i);
            }
        }
    }

    public int size() {
        return samples.size();
    }

    public PosteriorSample get(int drawIndex) {
        return samples.get(drawIndex);
    }

    /** Среднее по выборкам компоненты j состояния в точке t. */
    public double meanState(int t, int j) {
        double s = 0;
        for (PosteriorSample p : samples) s += p.states()[t][j];
        return s / samples.size();
    }
}
