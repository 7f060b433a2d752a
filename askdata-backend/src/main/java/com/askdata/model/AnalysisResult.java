package com.askdata.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed outcome of executing a plan: a scalar, a series or a table.
 *
 * <p>Results never carry NaN or infinite numbers. Values that cannot be computed are reported with
 * an {@code undefined} marker and an explanatory note instead.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScalarResult.class, name = ScalarResult.TYPE),
        @JsonSubTypes.Type(value = SeriesResult.class, name = SeriesResult.TYPE),
        @JsonSubTypes.Type(value = TableResult.class, name = TableResult.TYPE)
})
public abstract class AnalysisResult {

    /**
     * Warnings attached during execution (type mismatches, dropped values, empty filters).
     */
    private List<String> notes = new ArrayList<>();

    /**
     * True when no rows were left to analyse.
     */
    private boolean empty;

    public abstract String getType();

    public AnalysisResult addNote(String note) {
        if (note != null && !note.isBlank()) {
            notes.add(note);
        }
        return this;
    }
}
