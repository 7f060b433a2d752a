package com.askdata.job;

import com.askdata.model.ScalarResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisJobTest {

    private AnalysisJob job;

    @BeforeEach
    void setUp() {
        job = new AnalysisJob("j1", "s1", "total sales", true);
    }

    @Test
    void testNewJobHasPendingSteps() {
        JobSnapshot snapshot = job.snapshot();

        assertEquals(JobStatus.PENDING, snapshot.getStatus());
        assertEquals(PipelineStage.values().length, snapshot.getSteps().size());
        assertEquals("Ingest Check", snapshot.getSteps().get(0).getName());
        assertEquals("Response Generation", snapshot.getSteps().get(4).getName());
        assertTrue(snapshot.getSteps().stream().allMatch(s -> s.getStatus() == StepStatus.PENDING));
    }

    @Test
    void testCompleteRunExposesResult() {
        job.start();
        for (PipelineStage stage : PipelineStage.values()) {
            job.startStep(stage, "running");
            job.completeStep(stage, "done");
        }
        job.setResult(ScalarResult.of("sum(sales)", 1.0));
        job.complete();

        JobSnapshot snapshot = job.snapshot();
        assertEquals(JobStatus.COMPLETED, snapshot.getStatus());
        assertNotNull(snapshot.getResult());
        assertNotNull(snapshot.getCompletedAt());
        assertFalse(job.isActive());
    }

    @Test
    void testResultHiddenUntilCompleted() {
        job.start();
        job.setResult(ScalarResult.of("sum(sales)", 1.0));
        assertNull(job.snapshot().getResult());
    }

    @Test
    void testStepFailureEndsJobAndSkipsRest() {
        job.start();
        job.startStep(PipelineStage.INGEST_CHECK, "checking");
        job.completeStep(PipelineStage.INGEST_CHECK, "ok");
        job.startStep(PipelineStage.QUERY_UNDERSTANDING, "thinking");
        job.failStep(PipelineStage.QUERY_UNDERSTANDING, "Dataset is empty");

        JobSnapshot snapshot = job.snapshot();
        assertEquals(JobStatus.ERROR, snapshot.getStatus());
        assertEquals("Dataset is empty", snapshot.getError());
        assertEquals(StepStatus.COMPLETED, snapshot.getSteps().get(0).getStatus());
        assertEquals(StepStatus.ERROR, snapshot.getSteps().get(1).getStatus());
        for (int i = 2; i < snapshot.getSteps().size(); i++) {
            assertEquals(StepStatus.SKIPPED, snapshot.getSteps().get(i).getStatus());
        }
    }

    @Test
    void testFailBetweenStages() {
        job.start();
        job.startStep(PipelineStage.INGEST_CHECK, "checking");
        job.fail("Analysis cancelled");

        JobSnapshot snapshot = job.snapshot();
        assertEquals(JobStatus.ERROR, snapshot.getStatus());
        assertEquals(StepStatus.ERROR, snapshot.getSteps().get(0).getStatus());
        assertEquals(StepStatus.SKIPPED, snapshot.getSteps().get(1).getStatus());

        job.fail("again");
        assertEquals("Analysis cancelled", job.snapshot().getError());
    }

    @Test
    void testIllegalTransitionsThrow() {
        assertThrows(IllegalStateException.class, () -> job.startStep(PipelineStage.INGEST_CHECK, "early"));
        assertThrows(IllegalStateException.class, () -> job.completeStep(PipelineStage.INGEST_CHECK, "not started"));

        job.start();
        assertThrows(IllegalStateException.class, job::start);
        assertThrows(IllegalStateException.class, job::complete);

        job.startStep(PipelineStage.INGEST_CHECK, "checking");
        job.completeStep(PipelineStage.INGEST_CHECK, "ok");
        assertThrows(IllegalStateException.class, () -> job.startStep(PipelineStage.INGEST_CHECK, "again"));
    }

    @Test
    void testSnapshotIsDetached() {
        JobSnapshot before = job.snapshot();
        job.start();
        job.startStep(PipelineStage.INGEST_CHECK, "checking");

        assertEquals(StepStatus.PENDING, before.getSteps().get(0).getStatus());
        assertEquals(StepStatus.RUNNING, job.snapshot().getSteps().get(0).getStatus());
    }

    @Test
    void testStatusTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.COMPLETED.canTransitionTo(JobStatus.ERROR));
        assertTrue(StepStatus.PENDING.canTransitionTo(StepStatus.SKIPPED));
        assertFalse(StepStatus.SKIPPED.canTransitionTo(StepStatus.RUNNING));
        assertFalse(StepStatus.RUNNING.canTransitionTo(StepStatus.SKIPPED));
    }
}
