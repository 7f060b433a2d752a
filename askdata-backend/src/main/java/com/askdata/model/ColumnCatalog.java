package com.askdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of column names and inferred types for one dataset version.
 */
public final class ColumnCatalog {
    private final String datasetVersion;
    private final Map<String, ColumnType> types;

    public ColumnCatalog(String datasetVersion, Map<String, ColumnType> types) {
        this.datasetVersion = Objects.requireNonNull(datasetVersion, "datasetVersion");
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(types, "types")));
    }

    public String getDatasetVersion() {
        return datasetVersion;
    }

    /**
     * Column names in dataset order.
     *
     * @return unmodifiable list of names
     */
    public List<String> columns() {
        return List.copyOf(types.keySet());
    }

    public Map<String, ColumnType> asMap() {
        return types;
    }

    public boolean contains(String column) {
        return column != null && types.containsKey(column);
    }

    public Optional<ColumnType> typeOf(String column) {
        return column == null ? Optional.empty() : Optional.ofNullable(types.get(column));
    }

    public boolean isNumeric(String column) {
        return typeOf(column).map(ColumnType::isNumeric).orElse(false);
    }

    public List<String> numericColumns() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ColumnType> e : types.entrySet()) {
            if (e.getValue().isNumeric()) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public List<String> categoricalColumns() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ColumnType> e : types.entrySet()) {
            if (e.getValue() == ColumnType.CATEGORICAL) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public Optional<String> firstNumeric() {
        return numericColumns().stream().findFirst();
    }

    public Optional<String> firstCategorical() {
        return categoricalColumns().stream().findFirst();
    }

    public int size() {
        return types.size();
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }
}
