package com.askdata.history;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ChartSpec;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * One completed analysis kept in a session's history.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HistoryEntry {

    private String entryId;
    private String jobId;
    private String query;
    private AnalysisPlan plan;
    private AnalysisResult result;

    /**
     * Present only when the analysis ran with visualization enabled.
     */
    private ChartSpec chart;

    private String summary;
    private OffsetDateTime completedAt;
    private boolean hadVisualization;
}
