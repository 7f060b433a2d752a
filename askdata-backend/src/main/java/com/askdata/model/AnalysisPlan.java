package com.askdata.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic description of a single analysis, compiled from a query against one catalog snapshot.
 *
 * <p>Column references are only meaningful for the catalog whose {@code datasetVersion} is recorded here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisPlan {

    /**
     * Plans scoring below this are reported as low-confidence resolutions.
     */
    public static final double LOW_CONFIDENCE_THRESHOLD = 0.5;

    private String query;
    private Operation operation;
    private String targetColumn;
    private String groupColumn;
    private AggregationMethod aggregationMethod;

    @Builder.Default
    private List<PlanFilter> filters = new ArrayList<>();

    private VisualizationHint visualizationHint;
    private String description;
    private double resolutionConfidence;
    private boolean lowConfidence;
    private String datasetVersion;
}
