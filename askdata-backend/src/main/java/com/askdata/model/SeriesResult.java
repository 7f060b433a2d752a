package com.askdata.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered label to number mapping, with optional summary metadata.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SeriesResult extends AnalysisResult {
    public static final String TYPE = "series";

    private String labelName;
    private String valueName;
    private List<SeriesPoint> points = new ArrayList<>();

    /**
     * Summary scalars such as mean and std for distributions. Values are finite numbers or null.
     */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public SeriesResult(String labelName, String valueName) {
        this.labelName = labelName;
        this.valueName = valueName;
    }

    public SeriesResult add(SeriesPoint point) {
        points.add(point);
        return this;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
