package com.askdata.api;

import com.askdata.history.HistoryEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HistoryResponse {
    private String sessionId;
    private int maxEntries;

    /**
     * Most recent first.
     */
    private List<HistoryEntry> entries;
}
