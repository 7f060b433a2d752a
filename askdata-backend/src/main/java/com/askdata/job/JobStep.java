package com.askdata.job;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress entry for one pipeline stage. Mutated only by its owning {@link AnalysisJob}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobStep {
    private String name;
    private StepStatus status;
    private String message;

    JobStep copy() {
        return new JobStep(name, status, message);
    }
}
