package com.chicu.causalimpact.web.dto;

import com.chicu.causalimpact.series.Period;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;

import java.time.Instant;

/**
 * Период в JSON: ISO-дата или дата-время, границы включительно.
 */
public record PeriodDto(String start, String end) {

    public Period toPeriod() {
        Instant s = TimeSeriesPreprocessor.parseTimestamp(start);
        Instant e = TimeSeriesPreprocessor.parseTimestamp(end);
        if (s == null || e == null) {
            throw new IllegalArgumentException("period needs both start and end");
        }
        return new Period(s, e);
    }
}
