package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic type inferred for a dataset column.
 */
public enum ColumnType {
    INTEGER,
    FLOAT,
    CATEGORICAL,
    TEXT,
    DATETIME;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
