package com.chicu.causalimpact.series;

import com.chicu.causalimpact.common.error.DuplicateTimestampException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Неизменяемый ряд одной группы: строго возрастающие метки времени,
 * один отклик и ноль или больше ковариат на точку.
 */
public final class TimeSeries {

    private final String groupKey;
    private final List<String> covariateNames;
    private final List<Observation> observations;

    public TimeSeries(String groupKey, List<String> covariateNames, List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("time series for group '" + groupKey + "' is empty");
        }
        this.groupKey = groupKey;
        this.covariateNames = List.copyOf(covariateNames == null ? List.of() : covariateNames);
        this.observations = List.copyOf(observations);

        Instant prev = null;
        for (Observation o : this.observations) {
            if (o.covariates().length != this.covariateNames.size()) {
                throw new IllegalArgumentException("observation at " + o.timestamp() + " has "
                        + o.covariates().length + " covariates, expected " + this.covariateNames.size());
            }
            if (prev != null) {
                if (o.timestamp().equals(prev)) {
                    throw new DuplicateTimestampException(groupKey, prev);
                }
                if (o.timestamp().isBefore(prev)) {
                    throw new IllegalArgumentException("timestamps must be increasing: "
                            + o.timestamp() + " after " + prev);
                }
            }
            prev = o.timestamp();
        }
    }

    public String groupKey() {
        return groupKey;
    }

    public List<String> covariateNames() {
        return covariateNames;
    }

    public int covariateCount() {
        return covariateNames.size();
    }

    public List<Observation> observations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public Observation get(int index) {
        return observations.get(index);
    }

    public Instant timestamp(int index) {
        return observations.get(index).timestamp();
    }

    public Instant firstTimestamp() {
        return observations.get(0).timestamp();
    }

    public Instant lastTimestamp() {
        return observations.get(observations.size() - 1).timestamp();
    }

    public Period range() {
        return new Period(firstTimestamp(), lastTimestamp());
    }

    /** Индекс первой точки с меткой >= ts, либо size(), если таких нет. */
    public int indexAtOrAfter(Instant ts) {
        int lo = 0;
        int hi = observations.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (timestamp(mid).isBefore(ts)) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /** Индекс последней точки с меткой <= ts, либо -1. */
    public int indexAtOrBefore(Instant ts) {
        int idx = indexAtOrAfter(ts);
        if (idx < observations.size() && timestamp(idx).equals(ts)) return idx;
        return idx - 1;
    }

    /** Сколько точек с наблюдённым откликом попадает в период. */
    public int countObserved(Period period) {
        int n = 0;
        for (Observation o : observations) {
            if (period.contains(o.timestamp()) && o.hasResponse()) n++;
        }
        return n;
    }

    public int countWithin(Period period) {
        int n = 0;
        for (Observation o : observations) {
            if (period.contains(o.timestamp())) n++;
        }
        return n;
    }

    /**
     * Копия ряда без указанных ковариат (для auto-drop вырожденных колонок).
     */
    public TimeSeries withoutCovariates(Set<String> dropped) {
        if (dropped == null || dropped.isEmpty()) return this;

        List<Integer> keep = new ArrayList<>();
        List<String> keptNames = new ArrayList<>();
        for (int j = 0; j < covariateNames.size(); j++) {
            if (!dropped.contains(covariateNames.get(j))) {
                keep.add(j);
                keptNames.add(covariateNames.get(j));
            }
        }

        List<Observation> out = new ArrayList<>(observations.size());
        for (Observation o : observations) {
            double[] x = new double[keep.size()];
            for (int j = 0; j < keep.size(); j++) {
                x[j] = o.covariate(keep.get(j));
            }
            out.add(new Observation(o.timestamp(), o.response(), x));
        }
        return new TimeSeries(groupKey, keptNames, out);
    }

    @Override
    public String toString() {
        return "TimeSeries[group=" + groupKey + ", size=" + size() + ", covariates=" + covariateNames
                + ", range=" + range() + "]";
    }
}
