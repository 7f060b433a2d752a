package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Chart kind suggested by a plan. Also used as the kind of a {@link ChartSpec}.
 */
public enum VisualizationHint {
    BAR,
    LINE,
    HISTOGRAM,
    PIE,
    TABLE,
    NONE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VisualizationHint fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return VisualizationHint.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
