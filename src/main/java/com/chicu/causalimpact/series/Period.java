package com.chicu.causalimpact.series;

import org.jetbrains.annotations.Contract;

import java.time.Instant;
import java.util.Objects;

/**
 * Закрытый интервал времени [start, end].
 */
public record Period(Instant start, Instant end) {

    public Period {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("period end " + end + " is before start " + start);
        }
    }

    public static Period of(Instant start, Instant end) {
        return new Period(start, end);
    }

    @Contract(pure = true)
    public boolean contains(Instant ts) {
        return ts != null && !ts.isBefore(start) && !ts.isAfter(end);
    }

    /** true, если этот период целиком раньше другого. */
    @Contract(pure = true)
    public boolean precedes(Period other) {
        return end.isBefore(other.start);
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
