package com.chicu.causalimpact.series;

import com.chicu.causalimpact.common.error.InsufficientDataException;
import com.chicu.causalimpact.common.error.SchemaException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Валидация входной таблицы и разбиение ряда на pre/post.
 * Чистые функции: ничего не кэширует и не меняет вход.
 */
@Slf4j
@Service
public class TimeSeriesPreprocessor {

    // =========================================================
    // schema
    // =========================================================

    public void requireColumns(RawTable table, TableSchema schema) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(schema, "schema");

        List<String> missing = new ArrayList<>();
        for (String col : schema.requiredColumns()) {
            if (!table.hasColumn(col)) missing.add(col);
        }

        if (!missing.isEmpty()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("missingColumns", missing);
            d.put("requiredColumns", List.copyOf(schema.requiredColumns()));
            d.put("availableColumns", table.columns());
            throw new SchemaException("missing required columns " + missing, d);
        }
    }

    /**
     * Группы (рынки) в порядке первого появления.
     */
    public List<String> groups(RawTable table, TableSchema schema) {
        requireColumns(table, schema);

        Set<String> out = new LinkedHashSet<>();
        for (Map<String, Object> row : table.rows()) {
            Object g = row.get(schema.groupKeyColumn());
            if (g != null) out.add(String.valueOf(g));
        }
        return List.copyOf(out);
    }

    /**
     * Строки одной группы → отсортированный TimeSeries (отклик + ковариаты).
     */
    public TimeSeries extract(RawTable table, TableSchema schema, String groupKey) {
        requireColumns(table, schema);
        if (groupKey == null || groupKey.isBlank()) {
            throw new SchemaException("group key value is blank", Map.of("groupKeyColumn", schema.groupKeyColumn()));
        }

        List<String> covariates = schema.covariateColumns();
        List<Observation> obs = new ArrayList<>();

        int rowNo = 0;
        for (Map<String, Object> row : table.rows()) {
            rowNo++;
            Object g = row.get(schema.groupKeyColumn());
            if (g == null || !groupKey.equals(String.valueOf(g))) continue;

            Instant ts = toInstant(row.get(schema.timestampColumn()), schema.timestampColumn(), rowNo);
            Double y = toNullableDouble(row.get(schema.responseColumn()), schema.responseColumn(), rowNo);

            double[] x = new double[covariates.size()];
            for (int j = 0; j < covariates.size(); j++) {
                String col = covariates.get(j);
                Double v = toNullableDouble(row.get(col), col, rowNo);
                if (v == null) {
                    throw new SchemaException("covariate '" + col + "' is missing at row " + rowNo,
                            cell(col, rowNo, row.get(col)));
                }
                x[j] = v;
            }

            obs.add(new Observation(ts, y, x));
        }

        if (obs.isEmpty()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("groupKeyColumn", schema.groupKeyColumn());
            d.put("groupKey", groupKey);
            throw new SchemaException("no rows for group '" + groupKey + "'", d);
        }

        obs.sort(Comparator.comparing(Observation::timestamp));

        // дубли ловит сам TimeSeries (DuplicateTimestampException)
        TimeSeries series = new TimeSeries(groupKey, covariates, obs);

        log.debug("📥 extracted group={} points={} covariates={} range={}",
                groupKey, series.size(), covariates, series.range());
        return series;
    }

    // =========================================================
    // periods
    // =========================================================

    /**
     * pre = [min(ts), max(ts < pause)], post = [pause, max(ts)].
     */
    public PreparedSeries splitAtIntervention(TimeSeries series, Instant pause, int minPreObservations) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(pause, "intervention timestamp");

        Instant first = series.firstTimestamp();
        Instant last = series.lastTimestamp();

        if (!pause.isAfter(first)) {
            throw new InsufficientDataException("pre-period before intervention " + pause + " is empty",
                    minPreObservations, 0, periodContext(series, pause));
        }
        if (pause.isAfter(last)) {
            throw new InsufficientDataException("post-period from intervention " + pause + " is empty",
                    1, 0, periodContext(series, pause));
        }

        int postStart = series.indexAtOrAfter(pause);
        Instant preEnd = series.timestamp(postStart - 1);

        Period pre = new Period(first, preEnd);
        Period post = new Period(pause, last);
        return validatePeriods(series, pre, post, minPreObservations);
    }

    /**
     * Явно заданные периоды: pre целиком раньше post, оба внутри диапазона ряда.
     */
    public PreparedSeries validatePeriods(TimeSeries series, Period pre, Period post, int minPreObservations) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(pre, "pre");
        Objects.requireNonNull(post, "post");

        Period range = series.range();
        if (!pre.precedes(post)) {
            throw new IllegalArgumentException("pre-period " + pre + " must end before post-period " + post + " starts");
        }
        if (pre.start().isBefore(range.start()) || post.end().isAfter(range.end())) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("pre", pre.toString());
            d.put("post", post.toString());
            d.put("seriesRange", range.toString());
            throw new InsufficientDataException("periods " + pre + " / " + post
                    + " are outside the series range " + range, minPreObservations, 0, d);
        }

        int preObserved = series.countObserved(pre);
        if (preObserved < minPreObservations) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("groupKey", series.groupKey());
            d.put("pre", pre.toString());
            throw new InsufficientDataException("pre-period " + pre + " is too short",
                    minPreObservations, preObserved, d);
        }

        PreparedSeries prepared = PreparedSeries.of(series, pre, post);
        if (prepared.postLength() <= 0) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("post", post.toString());
            throw new InsufficientDataException("post-period " + post + " contains no observations", 1, 0, d);
        }

        for (int i = prepared.postStartIndex(); i <= prepared.postEndIndex(); i++) {
            if (!series.get(i).hasResponse()) {
                Map<String, Object> d = new LinkedHashMap<>();
                d.put("timestamp", String.valueOf(series.timestamp(i)));
                d.put("groupKey", series.groupKey());
                throw new SchemaException("response is missing in the post-period at " + series.timestamp(i), d);
            }
        }

        log.debug("✂️ periods group={} pre={} ({} obs) post={} ({} obs)",
                series.groupKey(), pre, preObserved, post, prepared.postLength());
        return prepared;
    }

    // =========================================================
    // coercion helpers
    // =========================================================

    /**
     * Instant / OffsetDateTime / ZonedDateTime / LocalDate / LocalDateTime / Date / epoch millis / ISO-строка.
     * Даты без зоны трактуются как UTC.
     */
    public static Instant parseTimestamp(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Instant i) return i;
        if (raw instanceof OffsetDateTime o) return o.toInstant();
        if (raw instanceof ZonedDateTime z) return z.toInstant();
        if (raw instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC);
        if (raw instanceof LocalDate d) return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        if (raw instanceof Date d) return d.toInstant();
        if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());

        String s = String.valueOf(raw).trim();
        if (s.isEmpty()) return null;

        int t = s.indexOf('T');
        if (t < 0) {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
        }

        String time = s.substring(t + 1);
        boolean withOffset = time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
        return withOffset
                ? OffsetDateTime.parse(s).toInstant()
                : LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
    }

    private static Instant toInstant(Object raw, String column, int rowNo) {
        Instant ts;
        try {
            ts = parseTimestamp(raw);
        } catch (DateTimeParseException e) {
            throw new SchemaException("column '" + column + "' has an unparsable timestamp at row " + rowNo
                    + ": '" + raw + "'", cell(column, rowNo, raw));
        }
        if (ts == null) {
            throw new SchemaException("column '" + column + "' is empty at row " + rowNo, cell(column, rowNo, raw));
        }
        return ts;
    }

    private static Double toNullableDouble(Object raw, String column, int rowNo) {
        if (raw == null) return null;
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            if (Double.isInfinite(v)) {
                throw new SchemaException("column '" + column + "' is infinite at row " + rowNo, cell(column, rowNo, raw));
            }
            return Double.isNaN(v) ? null : v;
        }

        String s = String.valueOf(raw).trim();
        if (s.isEmpty() || s.toLowerCase(Locale.ROOT).equals("nan")) return null;

        try {
            double v = Double.parseDouble(s);
            if (Double.isInfinite(v)) {
                throw new SchemaException("column '" + column + "' is infinite at row " + rowNo, cell(column, rowNo, raw));
            }
            return v;
        } catch (NumberFormatException e) {
            throw new SchemaException("column '" + column + "' is not numeric at row " + rowNo + ": '" + raw + "'",
                    cell(column, rowNo, raw));
        }
    }

    private static Map<String, Object> cell(String column, int rowNo, Object raw) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("column", column);
        d.put("row", rowNo);
        d.put("value", String.valueOf(raw));
        return d;
    }

    private static Map<String, Object> periodContext(TimeSeries series, Instant pause) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("groupKey", series.groupKey());
        d.put("interventionTimestamp", String.valueOf(pause));
        d.put("seriesRange", series.range().toString());
        return d;
    }
}
