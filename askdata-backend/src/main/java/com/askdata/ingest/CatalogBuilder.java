package com.askdata.ingest;

import com.askdata.model.ColumnCatalog;
import com.askdata.model.ColumnType;
import com.askdata.model.Dataset;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Infers column types from raw text and converts rows into typed cells.
 *
 * <p>A column whose non-missing values all parse as integers is {@code integer}; all decimals
 * gives {@code float}; all ISO-8601 dates or date-times gives {@code datetime}. Remaining columns
 * are {@code categorical} when they have fewer distinct values than half their non-missing rows,
 * and {@code text} otherwise. A column with no values at all is {@code text}.
 */
public class CatalogBuilder {

    private static final Set<String> MISSING_MARKERS = Set.of("", "na", "n/a", "null", "none");
    private static final double CATEGORICAL_RATIO = 0.5;
    private static final List<Function<String, ?>> DATE_PARSERS = List.of(
            LocalDate::parse,
            LocalDateTime::parse,
            OffsetDateTime::parse
    );

    /**
     * Builds a new dataset version from raw text cells.
     *
     * @param sourceName name of the source file
     * @param columns header names
     * @param rawRows rows of raw text, each as wide as {@code columns}
     * @return typed dataset with its catalog
     */
    public LoadedDataset build(String sourceName, List<String> columns, List<List<String>> rawRows) {
        String version = UUID.randomUUID().toString();
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            List<String> values = new ArrayList<>(rawRows.size());
            for (List<String> row : rawRows) {
                values.add(row.get(c));
            }
            types.put(columns.get(c), inferType(values));
        }

        List<ColumnType> ordered = new ArrayList<>(types.values());
        List<List<Object>> rows = new ArrayList<>(rawRows.size());
        for (List<String> raw : rawRows) {
            List<Object> row = new ArrayList<>(raw.size());
            for (int c = 0; c < raw.size(); c++) {
                row.add(convert(raw.get(c), ordered.get(c)));
            }
            rows.add(row);
        }
        return new LoadedDataset(new Dataset(version, sourceName, columns, rows), new ColumnCatalog(version, types));
    }

    /**
     * Builds the catalog of an already typed dataset.
     *
     * @param dataset dataset
     * @return catalog carrying the dataset's version
     */
    public ColumnCatalog catalogOf(Dataset dataset) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int c = 0; c < dataset.getColumns().size(); c++) {
            List<String> values = new ArrayList<>(dataset.rowCount());
            for (List<Object> row : dataset.getRows()) {
                Object v = row.get(c);
                values.add(v == null ? null : String.valueOf(v));
            }
            types.put(dataset.getColumns().get(c), inferType(values));
        }
        return new ColumnCatalog(dataset.getVersion(), types);
    }

    /**
     * Infers the semantic type of one column.
     *
     * @param values raw values, null or missing markers allowed
     * @return inferred type
     */
    public static ColumnType inferType(List<String> values) {
        boolean allLong = true;
        boolean allDouble = true;
        boolean allDate = true;
        int nonMissing = 0;
        Set<String> distinct = new HashSet<>();
        for (String raw : values) {
            if (isMissing(raw)) {
                continue;
            }
            String v = raw.trim();
            nonMissing++;
            distinct.add(v);
            if (allLong && parseLong(v) == null) {
                allLong = false;
            }
            if (allDouble && parseDouble(v) == null) {
                allDouble = false;
            }
            if (allDate && !isIsoDate(v)) {
                allDate = false;
            }
        }
        if (nonMissing == 0) {
            return ColumnType.TEXT;
        }
        if (allLong) {
            return ColumnType.INTEGER;
        }
        if (allDouble) {
            return ColumnType.FLOAT;
        }
        if (allDate) {
            return ColumnType.DATETIME;
        }
        return distinct.size() < nonMissing * CATEGORICAL_RATIO ? ColumnType.CATEGORICAL : ColumnType.TEXT;
    }

    static Object convert(String raw, ColumnType type) {
        if (isMissing(raw)) {
            return null;
        }
        String v = raw.trim();
        switch (type) {
            case INTEGER:
                return parseLong(v);
            case FLOAT:
                return parseDouble(v);
            default:
                return v;
        }
    }

    static boolean isMissing(String raw) {
        return raw == null || MISSING_MARKERS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    private static Long parseLong(String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String v) {
        // Double.parseDouble also accepts hex floats and a trailing d/f; keep to plain decimals.
        char last = v.charAt(v.length() - 1);
        if (Character.isLetter(last) && !v.equalsIgnoreCase("nan") && !v.toLowerCase(Locale.ROOT).endsWith("infinity")) {
            return null;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isIsoDate(String v) {
        for (Function<String, ?> parser : DATE_PARSERS) {
            try {
                parser.apply(v);
                return true;
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return false;
    }
}
