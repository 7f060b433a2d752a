package com.askdata.api;

import com.askdata.model.ColumnType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Overview of the session's dataset.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataInfoResponse {
    private String sessionId;
    private String sourceName;
    private String datasetVersion;
    private int rows;
    private List<String> columns;
    private Map<String, ColumnType> columnTypes;

    /**
     * First rows of the dataset keyed by column name; non-finite numbers are rendered as null.
     */
    private List<Map<String, Object>> sampleRows;

    /**
     * Count of missing cells per column.
     */
    private Map<String, Long> missingValues;
}
