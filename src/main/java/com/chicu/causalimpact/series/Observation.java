package com.chicu.causalimpact.series;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Одна точка ряда: отклик (может отсутствовать только в pre-периоде) и ковариаты.
 */
public record Observation(Instant timestamp, Double response, double[] covariates) {

    public Observation {
        Objects.requireNonNull(timestamp, "timestamp");
        covariates = covariates == null ? new double[0] : covariates.clone();
    }

    public boolean hasResponse() {
        return response != null && !response.isNaN();
    }

    public double covariate(int index) {
        return covariates[index];
    }

    @Override
    public double[] covariates() {
        return covariates.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation that)) return false;
        return timestamp.equals(that.timestamp)
                && Objects.equals(response, that.response)
                && Arrays.equals(covariates, that.covariates);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(timestamp, response) + Arrays.hashCode(covariates);
    }

    @Override
    public String toString() {
        return "Observation[" + timestamp + ", y=" + response + ", x=" + Arrays.toString(covariates) + "]";
    }
}
