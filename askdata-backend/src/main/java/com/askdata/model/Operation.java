package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Analysis operation a plan asks the executor to perform.
 */
public enum Operation {
    SUM,
    MEAN,
    COUNT,
    MAX,
    MIN,
    UNIQUE_COUNT,
    VALUE_COUNTS,
    GROUP_BY,
    DISTRIBUTION,
    DESCRIBE;

    /**
     * Whether the operation aggregates a numeric column into a single number.
     *
     * @return true for sum, mean, max and min
     */
    public boolean isNumericAggregate() {
        return this == SUM || this == MEAN || this == MAX || this == MIN;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Operation fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("operation is required");
        }
        return Operation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
