package com.askdata.api;

import com.askdata.ingest.LoadedDataset;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity and shape of the dataset installed on a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DatasetSummary {
    private String sourceName;
    private String datasetVersion;
    private int rows;
    private int columns;

    public static DatasetSummary of(LoadedDataset loaded) {
        if (loaded == null) {
            return null;
        }
        return DatasetSummary.builder()
                .sourceName(loaded.dataset().getSourceName())
                .datasetVersion(loaded.dataset().getVersion())
                .rows(loaded.dataset().rowCount())
                .columns(loaded.dataset().getColumns().size())
                .build();
    }
}
