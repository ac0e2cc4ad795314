package com.chicu.causalimpact.series;

import java.util.Objects;

/**
 * Ряд, разбитый на pre/post. Индексы вычисляются один раз и дальше используются всеми этапами.
 */
public record PreparedSeries(
        TimeSeries series,
        Period pre,
        Period post,
        int preStartIndex,
        int preEndIndex,
        int postStartIndex,
        int postEndIndex
) {

    public PreparedSeries {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(pre, "pre");
        Objects.requireNonNull(post, "post");
    }

    public static PreparedSeries of(TimeSeries series, Period pre, Period post) {
        int preStart = series.indexAtOrAfter(pre.start());
        int preEnd = series.indexAtOrBefore(pre.end());
        int postStart = series.indexAtOrAfter(post.start());
        int postEnd = series.indexAtOrBefore(post.end());
        return new PreparedSeries(series, pre, post, preStart, preEnd, postStart, postEnd);
    }

    public int preLength() {
        return preEndIndex - preStartIndex + 1;
    }

    public int postLength() {
        return postEndIndex - postStartIndex + 1;
    }

    /** Точки от начала pre до конца post: это окно модели. */
    public int modelLength() {
        return postEndIndex - preStartIndex + 1;
    }

    public boolean isPre(int index) {
        return index >= preStartIndex && index <= preEndIndex;
    }

    public boolean isPost(int index) {
        return index >= postStartIndex && index <= postEndIndex;
    }

    public PreparedSeries withSeries(TimeSeries replaced) {
        return PreparedSeries.of(replaced, pre, post);
    }
}
