package com.askdata.api;

import com.askdata.model.ColumnType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CatalogResponse {
    private String sessionId;
    private String datasetVersion;

    /**
     * Column name to inferred type, in dataset column order.
     */
    private Map<String, ColumnType> columns;

    private List<String> numericColumns;
    private List<String> categoricalColumns;
}
