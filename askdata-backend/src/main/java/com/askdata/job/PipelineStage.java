package com.askdata.job;

/**
 * Stages every analysis job goes through, in order.
 */
public enum PipelineStage {
    INGEST_CHECK("Ingest Check"),
    QUERY_UNDERSTANDING("Query Understanding"),
    DATA_ANALYSIS("Data Analysis"),
    VISUALIZATION("Visualization"),
    RESPONSE_GENERATION("Response Generation");

    private final String displayName;

    PipelineStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
