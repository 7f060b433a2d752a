package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison used by a {@link PlanFilter}.
 */
public enum FilterOperator {
    EQ("="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("filter operator is required");
        }
        return FilterOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
