package com.askdata.job;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResponse;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ChartSpec;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Consistent copy of a job's state for polling clients.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobSnapshot {
    private String jobId;
    private String sessionId;
    private String query;
    private boolean enableVisualization;
    private JobStatus status;
    private List<JobStep> steps;
    private AnalysisPlan plan;

    /**
     * Set only once the job has completed.
     */
    private AnalysisResult result;
    private ChartSpec chart;
    private AnalysisResponse response;

    private String error;
    private OffsetDateTime createdAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
}
