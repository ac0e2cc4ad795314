package com.chicu.causalimpact.effect;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Таблица результата: по строке на каждую метку исходного ряда.
 */
public record InferenceResult(List<InferenceRow> rows) {

    public InferenceResult {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public InferenceRow row(int index) {
        return rows.get(index);
    }

    public Optional<InferenceRow> row(Instant timestamp) {
        return rows.stream().filter(r -> r.timestamp().equals(timestamp)).findFirst();
    }

    /** Колонка целиком (с null там, где значение не определено). */
    public List<Double> column(ResultField field) {
        List<Double> out = new ArrayList<>(rows.size());
        for (InferenceRow r : rows) out.add(r.get(field));
        return out;
    }

    public InferenceRow last() {
        return rows.get(rows.size() - 1);
    }
}
