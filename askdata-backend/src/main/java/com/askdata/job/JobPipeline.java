package com.askdata.job;

import com.askdata.executor.AnalysisExecutionException;
import com.askdata.executor.PlanExecutor;
import com.askdata.ingest.LoadedDataset;
import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.Dataset;
import com.askdata.planner.PlanCompiler;
import com.askdata.viz.ResponseFormatter;
import com.askdata.viz.VisualizationSelector;

import java.util.Objects;

/**
 * Work done by each {@link PipelineStage}. A stage reads what earlier stages stored on the job and
 * stores its own output there; it returns the step message or throws
 * {@link AnalysisExecutionException} with a message for the user.
 */
public class JobPipeline {

    private final PlanCompiler compiler;
    private final PlanExecutor executor;
    private final VisualizationSelector visualizationSelector;
    private final ResponseFormatter responseFormatter;

    public JobPipeline(
            PlanCompiler compiler,
            PlanExecutor executor,
            VisualizationSelector visualizationSelector,
            ResponseFormatter responseFormatter
    ) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.visualizationSelector = Objects.requireNonNull(visualizationSelector, "visualizationSelector");
        this.responseFormatter = Objects.requireNonNull(responseFormatter, "responseFormatter");
    }

    /**
     * Message shown while a stage runs.
     */
    public static String runningMessage(PipelineStage stage) {
        switch (stage) {
            case INGEST_CHECK:
                return "Checking dataset";
            case QUERY_UNDERSTANDING:
                return "Interpreting question";
            case DATA_ANALYSIS:
                return "Running analysis";
            case VISUALIZATION:
                return "Building chart";
            default:
                return "Writing response";
        }
    }

    /**
     * Runs one stage.
     *
     * @param stage stage to run
     * @param job job being processed
     * @param current dataset installed on the job's session, null when none
     * @return completion message for the step
     */
    public String run(PipelineStage stage, AnalysisJob job, LoadedDataset current) {
        switch (stage) {
            case INGEST_CHECK:
                return ingestCheck(job, current);
            case QUERY_UNDERSTANDING:
                return understand(job);
            case DATA_ANALYSIS:
                return analyse(job);
            case VISUALIZATION:
                return visualize(job);
            case RESPONSE_GENERATION:
            default:
                return respond(job);
        }
    }

    private String ingestCheck(AnalysisJob job, LoadedDataset current) {
        Dataset dataset = current != null ? current.dataset() : null;
        ColumnCatalog catalog = current != null ? current.catalog() : null;
        if (dataset == null || catalog == null) {
            throw new AnalysisExecutionException("No dataset loaded");
        }
        if (dataset.rowCount() == 0) {
            throw new AnalysisExecutionException("Dataset is empty");
        }
        if (!dataset.getVersion().equals(catalog.getDatasetVersion())) {
            throw new AnalysisExecutionException("Column catalog is out of date; please reload the dataset");
        }
        job.attachDataset(dataset, catalog);
        return "Dataset " + dataset.getSourceName() + " ready: " + dataset.rowCount() + " rows, "
                + dataset.getColumns().size() + " columns";
    }

    private String understand(AnalysisJob job) {
        AnalysisPlan plan = compiler.compile(job.getQuery(), job.getCatalog());
        job.setPlan(plan);
        String message = plan.getDescription();
        if (plan.isLowConfidence()) {
            message += " (low confidence)";
        }
        return message;
    }

    private String analyse(AnalysisJob job) {
        AnalysisResult result = executor.execute(job.getPlan(), job.getDataset(), job.getCatalog());
        job.setResult(result);
        if (result.getNotes().isEmpty()) {
            return "Analysis complete";
        }
        return "Analysis complete with warnings: " + String.join("; ", result.getNotes());
    }

    private String visualize(AnalysisJob job) {
        job.setChart(visualizationSelector.select(job.getPlan(), job.getResult()));
        return "Chart ready: " + job.getChart().getKind().getValue();
    }

    private String respond(AnalysisJob job) {
        job.setResponse(responseFormatter.format(job.getQuery(), job.getPlan(), job.getResult()));
        return "Response ready";
    }
}
