package com.askdata.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One labelled value of a {@link SeriesResult}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SeriesPoint {
    private String label;
    private Double value;
    private boolean undefined;

    /**
     * Creates a point, marking it undefined when the value is NaN or infinite.
     *
     * @param label point label
     * @param value computed value
     * @return series point
     */
    public static SeriesPoint of(String label, double value) {
        if (!Double.isFinite(value)) {
            return undefined(label);
        }
        return new SeriesPoint(label, value, false);
    }

    public static SeriesPoint undefined(String label) {
        return new SeriesPoint(label, null, true);
    }
}
