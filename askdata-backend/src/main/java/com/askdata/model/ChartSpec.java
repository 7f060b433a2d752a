package com.askdata.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Declarative chart description handed to a renderer. Carries data only, never drawing code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChartSpec {
    private VisualizationHint kind;
    private String title;
    private String categoryLabel;
    private String valueLabel;

    @Builder.Default
    private List<Point> series = new ArrayList<>();

    /**
     * Only set for {@code table} charts.
     */
    private List<String> columns;
    private List<Map<String, Object>> rows;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private String name;
        private double value;
    }
}
