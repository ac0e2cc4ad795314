package com.chicu.causalimpact.estimation;

import java.util.List;

/**
 * Результат проверки матрицы регрессоров pre-периода.
 *
 * @param offendingCovariates ковариаты, которые не добавляют ранга (константные или коллинеарные)
 * @param rank                ранг матрицы [1, X]
 * @param columns             число колонок [1, X]
 */
public record DegeneracyReport(List<String> offendingCovariates, int rank, int columns) {

    public DegeneracyReport {
        offendingCovariates = List.copyOf(offendingCovariates);
    }

    public boolean degenerate() {
        return !offendingCovariates.isEmpty();
    }
}
