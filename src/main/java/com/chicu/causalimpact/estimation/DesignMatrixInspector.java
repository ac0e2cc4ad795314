package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RRQRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка ранга [1, X] на pre-периоде.
 * Колонки добавляются по одной: ковариата, которая не увеличивает ранг, считается виновной.
 * Константа коллинеарна со свободным членом (уровнем), поэтому тоже ловится здесь.
 */
@Slf4j
@Component
public class DesignMatrixInspector {

    private static final double RANK_THRESHOLD = 1e-9;

    public DegeneracyReport inspect(PreparedSeries prepared) {
        TimeSeries series = prepared.series();
        int k = series.covariateCount();
        int rows = prepared.preLength();

        if (k == 0) {
            return new DegeneracyReport(List.of(), 1, 1);
        }

        // колонки нормируем, чтобы порог ранга не зависел от масштаба ковариат
        double[][] columns = new double[k + 1][rows];
        for (int r = 0; r < rows; r++) columns[0][r] = 1.0 / Math.sqrt(rows);

        for (int j = 0; j < k; j++) {
            double norm = 0;
            for (int r = 0; r < rows; r++) {
                double v = series.get(prepared.preStartIndex() + r).covariate(j);
                columns[j + 1][r] = v;
                norm += v * v;
            }
            norm = Math.sqrt(norm);
            if (norm > 0) {
                for (int r = 0; r < rows; r++) columns[j + 1][r] /= norm;
            }
        }

        List<double[]> kept = new ArrayList<>();
        kept.add(columns[0]);
        int rank = 1;

        List<String> offending = new ArrayList<>();
        for (int j = 0; j < k; j++) {
            kept.add(columns[j + 1]);
            int r = rankOf(kept, rows);
            if (r > rank) {
                rank = r;
            } else {
                kept.remove(kept.size() - 1);
                offending.add(series.covariateNames().get(j));
            }
        }

        if (!offending.isEmpty()) {
            log.debug("🔎 degenerate covariates group={} offending={} rank={}/{}",
                    series.groupKey(), offending, rank, k + 1);
        }
        return new DegeneracyReport(offending, rank, k + 1);
    }

    private static int rankOf(List<double[]> columns, int rows) {
        int c = columns.size();
        if (c > rows) {
            // больше колонок, чем строк: ранг не может вырасти
            return Math.min(rows, c - 1);
        }
        RealMatrix m = MatrixUtils.createRealMatrix(rows, c);
        for (int j = 0; j < c; j++) {
            m.setColumn(j, columns.get(j));
        }
        return new RRQRDecomposition(m, RANK_THRESHOLD).getRank(RANK_THRESHOLD);
    }
}
