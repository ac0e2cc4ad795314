package com.chicu.causalimpact.series;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Уже распарсенная таблица (строки как map колонка -> значение).
 * Загрузка из CSV/БД сюда не входит.
 */
public record RawTable(List<String> columns, List<Map<String, Object>> rows) {

    public RawTable {
        columns = List.copyOf(columns == null ? List.of() : columns);
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> r : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    /**
     * Таблица, у которой набор колонок выводится из ключей строк (в порядке появления).
     */
    public static RawTable fromRows(List<Map<String, Object>> rows) {
        Set<String> cols = new LinkedHashSet<>();
        if (rows != null) {
            for (Map<String, Object> r : rows) cols.addAll(r.keySet());
        }
        return new RawTable(new ArrayList<>(cols), rows);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }
}
