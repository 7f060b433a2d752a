package com.askdata.job;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResponse;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ChartSpec;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.Dataset;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One submitted analysis and its progress trail.
 *
 * <p>All mutation happens under this object's monitor, and {@link #snapshot()} copies state under
 * the same monitor, so a poller never sees a half-applied update. Status and step transitions
 * are checked; an illegal transition throws {@link IllegalStateException}.
 */
public class AnalysisJob {

    private final String id;
    private final String sessionId;
    private final String query;
    private final boolean enableVisualization;
    private final OffsetDateTime createdAt;
    private final List<JobStep> steps = new ArrayList<>();

    private JobStatus status = JobStatus.PENDING;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String error;

    private Dataset dataset;
    private ColumnCatalog catalog;
    private AnalysisPlan plan;
    private AnalysisResult result;
    private ChartSpec chart;
    private AnalysisResponse response;

    private volatile boolean cancelRequested;

    public AnalysisJob(String id, String sessionId, String query, boolean enableVisualization) {
        this.id = Objects.requireNonNull(id, "id");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.query = query;
        this.enableVisualization = enableVisualization;
        this.createdAt = OffsetDateTime.now();
        for (PipelineStage stage : PipelineStage.values()) {
            steps.add(new JobStep(stage.getDisplayName(), StepStatus.PENDING, null));
        }
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQuery() {
        return query;
    }

    public boolean isEnableVisualization() {
        return enableVisualization;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized boolean isActive() {
        return !status.isTerminal();
    }

    public synchronized OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void requestCancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized void start() {
        transition(JobStatus.RUNNING);
        startedAt = OffsetDateTime.now();
    }

    public synchronized void startStep(PipelineStage stage, String message) {
        requireRunning();
        JobStep step = step(stage);
        transition(step, StepStatus.RUNNING);
        step.setMessage(message);
    }

    public synchronized void completeStep(PipelineStage stage, String message) {
        JobStep step = step(stage);
        transition(step, StepStatus.COMPLETED);
        step.setMessage(message);
    }

    public synchronized void skipStep(PipelineStage stage, String message) {
        JobStep step = step(stage);
        transition(step, StepStatus.SKIPPED);
        step.setMessage(message);
    }

    /**
     * Marks a running step as failed, skips the remaining steps and ends the job in error.
     *
     * @param stage failing stage
     * @param message error shown to the user
     */
    public synchronized void failStep(PipelineStage stage, String message) {
        JobStep step = step(stage);
        transition(step, StepStatus.ERROR);
        step.setMessage(message);
        endInError(message);
    }

    /**
     * Ends the job in error between stages (cancellation, timeout). A running step is marked
     * failed; pending steps are skipped. No-op once the job is terminal.
     *
     * @param message error shown to the user
     */
    public synchronized void fail(String message) {
        if (status.isTerminal()) {
            return;
        }
        for (JobStep step : steps) {
            if (step.getStatus() == StepStatus.RUNNING) {
                step.setStatus(StepStatus.ERROR);
                step.setMessage(message);
            }
        }
        endInError(message);
    }

    public synchronized void complete() {
        complete(OffsetDateTime.now());
    }

    public synchronized void complete(OffsetDateTime at) {
        for (JobStep step : steps) {
            if (!step.getStatus().isTerminal()) {
                throw new IllegalStateException("Step '" + step.getName() + "' is still " + step.getStatus().getValue());
            }
        }
        transition(JobStatus.COMPLETED);
        completedAt = at;
    }

    public synchronized void attachDataset(Dataset dataset, ColumnCatalog catalog) {
        this.dataset = dataset;
        this.catalog = catalog;
    }

    public synchronized Dataset getDataset() {
        return dataset;
    }

    public synchronized ColumnCatalog getCatalog() {
        return catalog;
    }

    public synchronized AnalysisPlan getPlan() {
        return plan;
    }

    public synchronized void setPlan(AnalysisPlan plan) {
        this.plan = plan;
    }

    public synchronized AnalysisResult getResult() {
        return result;
    }

    public synchronized void setResult(AnalysisResult result) {
        this.result = result;
    }

    public synchronized ChartSpec getChart() {
        return chart;
    }

    public synchronized void setChart(ChartSpec chart) {
        this.chart = chart;
    }

    public synchronized AnalysisResponse getResponse() {
        return response;
    }

    public synchronized void setResponse(AnalysisResponse response) {
        this.response = response;
    }

    /**
     * Copies the job's state. Result, chart and response are only included once the job has completed.
     *
     * @return snapshot
     */
    public synchronized JobSnapshot snapshot() {
        List<JobStep> stepCopies = new ArrayList<>(steps.size());
        for (JobStep step : steps) {
            stepCopies.add(step.copy());
        }
        boolean done = status == JobStatus.COMPLETED;
        return JobSnapshot.builder()
                .jobId(id)
                .sessionId(sessionId)
                .query(query)
                .enableVisualization(enableVisualization)
                .status(status)
                .steps(stepCopies)
                .plan(plan)
                .result(done ? result : null)
                .chart(done ? chart : null)
                .response(done ? response : null)
                .error(error)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    private void endInError(String message) {
        for (JobStep step : steps) {
            if (step.getStatus() == StepStatus.PENDING) {
                step.setStatus(StepStatus.SKIPPED);
            }
        }
        transition(JobStatus.ERROR);
        error = message;
        completedAt = OffsetDateTime.now();
    }

    private void requireRunning() {
        if (status != JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + id + " is " + status.getValue() + ", not running");
        }
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal job transition " + status.getValue() + " -> " + next.getValue());
        }
        status = next;
    }

    private static void transition(JobStep step, StepStatus next) {
        if (!step.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for step '" + step.getName() + "': "
                    + step.getStatus().getValue() + " -> " + next.getValue());
        }
        step.setStatus(next);
    }

    private JobStep step(PipelineStage stage) {
        return steps.get(stage.ordinal());
    }
}
