package com.askdata.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Single number result.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScalarResult extends AnalysisResult {
    public static final String TYPE = "scalar";

    private String label;
    private Double value;
    private boolean undefined;

    public static ScalarResult of(String label, double value) {
        ScalarResult out = new ScalarResult();
        out.setLabel(label);
        if (Double.isFinite(value)) {
            out.setValue(value);
        } else {
            out.setUndefined(true);
        }
        return out;
    }

    public static ScalarResult undefined(String label) {
        ScalarResult out = new ScalarResult();
        out.setLabel(label);
        out.setUndefined(true);
        return out;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
