package com.chicu.causalimpact.model;

import com.chicu.causalimpact.series.Observation;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Стандартизация отклика и ковариат по pre-периоду.
 * Нулевое стандартное отклонение (константа) даёт scale = 1.
 */
public record DataScaling(Scaling response, List<Scaling> covariates) {

    public DataScaling {
        covariates = List.copyOf(covariates);
    }

    public static DataScaling identity(int covariateCount) {
        List<Scaling> xs = new ArrayList<>(covariateCount);
        for (int j = 0; j < covariateCount; j++) xs.add(Scaling.IDENTITY);
        return new DataScaling(Scaling.IDENTITY, xs);
    }

    public static DataScaling fit(PreparedSeries prepared) {
        TimeSeries series = prepared.series();
        int k = series.covariateCount();

        SummaryStatistics y = new SummaryStatistics();
        SummaryStatistics[] x = new SummaryStatistics[k];
        for (int j = 0; j < k; j++) x[j] = new SummaryStatistics();

        for (int i = prepared.preStartIndex(); i <= prepared.preEndIndex(); i++) {
            Observation o = series.get(i);
            if (o.hasResponse()) y.addValue(o.response());
            for (int j = 0; j < k; j++) x[j].addValue(o.covariate(j));
        }

        List<Scaling> xs = new ArrayList<>(k);
        for (int j = 0; j < k; j++) xs.add(of(x[j]));
        return new DataScaling(of(y), xs);
    }

    public Scaling covariate(int j) {
        return covariates.get(j);
    }

    private static Scaling of(SummaryStatistics stats) {
        double mean = stats.getN() > 0 ? stats.getMean() : 0.0;
        double sd = stats.getN() > 1 ? stats.getStandardDeviation() : 0.0;
        return new Scaling(mean, sd > ModelHyperparameters.VARIANCE_FLOOR ? sd : 1.0);
    }
}
