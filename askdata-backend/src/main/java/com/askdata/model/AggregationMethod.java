package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggregation applied per partition of a group_by plan.
 */
public enum AggregationMethod {
    SUM,
    MEAN,
    COUNT,
    MAX,
    MIN;

    /**
     * Maps an operation onto the aggregation with the same meaning, if any.
     *
     * @param operation operation matched from the query
     * @return aggregation method, empty for operations with no per-group meaning
     */
    public static Optional<AggregationMethod> fromOperation(Operation operation) {
        if (operation == null) {
            return Optional.empty();
        }
        switch (operation) {
            case SUM:
                return Optional.of(SUM);
            case MEAN:
                return Optional.of(MEAN);
            case COUNT:
                return Optional.of(COUNT);
            case MAX:
                return Optional.of(MAX);
            case MIN:
                return Optional.of(MIN);
            default:
                return Optional.empty();
        }
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AggregationMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("aggregation_method is required");
        }
        return AggregationMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
