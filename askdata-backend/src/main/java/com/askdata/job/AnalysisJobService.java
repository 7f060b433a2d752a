package com.askdata.job;

import com.askdata.executor.AnalysisExecutionException;
import com.askdata.history.HistoryEntry;
import com.askdata.history.HistoryEntryNotFoundException;
import com.askdata.history.HistoryStore;
import com.askdata.service.AnalysisSession;
import com.askdata.service.SessionManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs analysis jobs for sessions.
 *
 * <p>Each stage of a job is a separate task on a shared scheduler, so stages of one job never
 * overlap while jobs of different sessions proceed concurrently. A session admits one job at a
 * time; submitting while one is pending or running fails with {@link JobActiveException}.
 * Cancellation and the timeout are checked between stages.
 */
@Service
public class AnalysisJobService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);

    static final String CANCELLED_MESSAGE = "Analysis cancelled";
    static final String TIMED_OUT_MESSAGE = "Analysis timed out";

    private static final PipelineStage[] STAGES = PipelineStage.values();

    private final SessionManager sessionManager;
    private final HistoryStore historyStore;
    private final JobPipeline pipeline;
    private final ScheduledExecutorService scheduler;
    private final long stageDelayMs;
    private final long timeoutMs;
    private final int maxTrackedPerSession;

    public AnalysisJobService(
            SessionManager sessionManager,
            HistoryStore historyStore,
            JobPipeline pipeline,
            @Value("${askdata.jobs.stage-delay-ms:0}") long stageDelayMs,
            @Value("${askdata.jobs.timeout-ms:60000}") long timeoutMs,
            @Value("${askdata.jobs.pool-size:4}") int poolSize,
            @Value("${askdata.jobs.max-tracked-per-session:20}") int maxTrackedPerSession
    ) {
        this.sessionManager = sessionManager;
        this.historyStore = historyStore;
        this.pipeline = pipeline;
        this.stageDelayMs = Math.max(0, stageDelayMs);
        this.timeoutMs = timeoutMs;
        this.maxTrackedPerSession = Math.max(1, maxTrackedPerSession);
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, poolSize));
    }

    /**
     * Creates a job for a query and starts it.
     *
     * @param sessionId session identifier
     * @param query user question
     * @param enableVisualization whether to build a chart
     * @return initial snapshot of the job
     * @throws JobActiveException when the session already has a job in progress
     */
    public JobSnapshot submit(String sessionId, String query, boolean enableVisualization) {
        AnalysisSession session = sessionManager.requireSession(sessionId);
        AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), sessionId, query, enableVisualization);
        session.beginJob(job, maxTrackedPerSession);
        log.info("Job submitted: session_id={}, job_id={}", sessionId, job.getId());
        scheduleStage(job, session, 0, 0);
        return job.snapshot();
    }

    /**
     * Re-submits a stored query as a new job, compiled against the session's current dataset.
     *
     * @param sessionId session identifier
     * @param entryId history entry to replay
     * @param enableVisualization whether to build a chart
     * @return initial snapshot of the new job
     */
    public JobSnapshot replay(String sessionId, String entryId, boolean enableVisualization) {
        sessionManager.requireSession(sessionId);
        HistoryEntry entry = historyStore.find(sessionId, entryId)
                .orElseThrow(() -> new HistoryEntryNotFoundException("History entry not found: " + entryId));
        return submit(sessionId, entry.getQuery(), enableVisualization);
    }

    public JobSnapshot getJob(String sessionId, String jobId) {
        return requireJob(sessionId, jobId).snapshot();
    }

    /**
     * Requests cancellation. The job ends in error at its next stage boundary.
     *
     * @param sessionId session identifier
     * @param jobId job identifier
     * @return snapshot taken after the request
     */
    public JobSnapshot cancel(String sessionId, String jobId) {
        AnalysisJob job = requireJob(sessionId, jobId);
        if (job.isActive()) {
            job.requestCancel();
            log.info("Job cancel requested: session_id={}, job_id={}", sessionId, jobId);
        }
        return job.snapshot();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private AnalysisJob requireJob(String sessionId, String jobId) {
        AnalysisSession session = sessionManager.requireSession(sessionId);
        return session.findJob(jobId)
                .orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    }

    private void scheduleStage(AnalysisJob job, AnalysisSession session, int index, long delayMs) {
        scheduler.schedule(() -> runStage(job, session, index), delayMs, TimeUnit.MILLISECONDS);
    }

    private void runStage(AnalysisJob job, AnalysisSession session, int index) {
        PipelineStage stage = STAGES[index];
        try {
            if (index == 0) {
                job.start();
            }
            if (job.isCancelRequested()) {
                finishWithError(job, session, CANCELLED_MESSAGE);
                return;
            }
            if (isTimedOut(job)) {
                finishWithError(job, session, TIMED_OUT_MESSAGE);
                return;
            }

            if (stage == PipelineStage.VISUALIZATION && !job.isEnableVisualization()) {
                job.skipStep(stage, "Visualization disabled");
            } else {
                job.startStep(stage, JobPipeline.runningMessage(stage));
                String message;
                try {
                    message = pipeline.run(stage, job, session.currentDataset());
                } catch (AnalysisExecutionException e) {
                    log.warn("Job stage failed: session_id={}, job_id={}, stage={}, reason={}",
                            job.getSessionId(), job.getId(), stage.getDisplayName(), e.getMessage());
                    job.failStep(stage, e.getMessage());
                    session.releaseJob(job.getId());
                    return;
                }
                job.completeStep(stage, message);
            }

            if (index + 1 < STAGES.length) {
                scheduleStage(job, session, index + 1, stageDelayMs);
                return;
            }
            finishCompleted(job, session);
        } catch (RuntimeException e) {
            log.error("Job failed: session_id={}, job_id={}, stage={}", job.getSessionId(), job.getId(), stage.getDisplayName(), e);
            job.fail("Internal error during " + stage.getDisplayName());
            session.releaseJob(job.getId());
        }
    }

    /**
     * Appends the history entry, then marks the job completed. Runs under the session monitor so
     * session termination sees either a cancelled job or a finished one.
     */
    private void finishCompleted(AnalysisJob job, AnalysisSession session) {
        synchronized (session) {
            if (job.isCancelRequested()) {
                finishWithError(job, session, CANCELLED_MESSAGE);
                return;
            }
            OffsetDateTime completedAt = OffsetDateTime.now();
            historyStore.append(job.getSessionId(), toHistoryEntry(job, completedAt));
            job.complete(completedAt);
            session.releaseJob(job.getId());
        }
        log.info("Job completed: session_id={}, job_id={}", job.getSessionId(), job.getId());
    }

    private void finishWithError(AnalysisJob job, AnalysisSession session, String message) {
        job.fail(message);
        session.releaseJob(job.getId());
        log.info("Job stopped: session_id={}, job_id={}, reason={}", job.getSessionId(), job.getId(), message);
    }

    private boolean isTimedOut(AnalysisJob job) {
        OffsetDateTime startedAt = job.getStartedAt();
        if (startedAt == null || timeoutMs <= 0) {
            return false;
        }
        return Duration.between(startedAt, OffsetDateTime.now()).toMillis() > timeoutMs;
    }

    private static HistoryEntry toHistoryEntry(AnalysisJob job, OffsetDateTime completedAt) {
        return HistoryEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .jobId(job.getId())
                .query(job.getQuery())
                .plan(job.getPlan())
                .result(job.getResult())
                .chart(job.isEnableVisualization() ? job.getChart() : null)
                .summary(job.getResponse() != null ? job.getResponse().getSummary() : null)
                .completedAt(completedAt)
                .hadVisualization(job.isEnableVisualization())
                .build();
    }
}
