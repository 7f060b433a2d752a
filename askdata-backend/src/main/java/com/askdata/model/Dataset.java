package com.askdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only tabular dataset owned by a session.
 *
 * <p>Cells hold {@link Long} for integer columns, {@link Double} for float columns and
 * {@link String} otherwise; {@code null} marks a missing value. The row and column lists are
 * unmodifiable, so every job reads the same snapshot.
 */
public final class Dataset {
    private final String version;
    private final String sourceName;
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> columnIndexes;

    public Dataset(String version, String sourceName, List<String> columns, List<List<Object>> rows) {
        this.version = Objects.requireNonNull(version, "version");
        this.sourceName = sourceName;
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));

        List<List<Object>> copied = new ArrayList<>(rows != null ? rows.size() : 0);
        if (rows != null) {
            for (List<Object> row : rows) {
                if (row == null || row.size() != this.columns.size()) {
                    throw new IllegalArgumentException("row width does not match column count " + this.columns.size());
                }
                copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copied);

        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (indexes.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("duplicate column name: " + this.columns.get(i));
            }
        }
        this.columnIndexes = Collections.unmodifiableMap(indexes);
    }

    public String getVersion() {
        return version;
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return column != null && columnIndexes.containsKey(column);
    }

    /**
     * Returns the position of a column.
     *
     * @param column column name
     * @return zero-based index
     * @throws IllegalArgumentException if the column does not exist
     */
    public int columnIndex(String column) {
        Integer idx = column != null ? columnIndexes.get(column) : null;
        if (idx == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return idx;
    }

    public Object value(int row, int columnIndex) {
        return rows.get(row).get(columnIndex);
    }
}
