package com.askdata.service;

import com.askdata.ingest.LoadedDataset;
import com.askdata.job.AnalysisJob;
import com.askdata.job.JobActiveException;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.Dataset;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A client's workspace: one dataset version with its catalog, the active job and recent jobs.
 *
 * <p>Dataset replacement and job admission are checked together under this object's monitor, so a
 * dataset never changes under a running job and at most one job is in progress at a time.
 */
public class AnalysisSession {
    private final String sessionId;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime expiresAt;
    private volatile OffsetDateTime lastAccessedAt;

    private Dataset dataset;
    private ColumnCatalog catalog;
    private String activeJobId;
    private final Map<String, AnalysisJob> recentJobs = new LinkedHashMap<>();

    public AnalysisSession(String sessionId, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastAccessedAt = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(OffsetDateTime lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public synchronized Dataset getDataset() {
        return dataset;
    }

    public synchronized ColumnCatalog getCatalog() {
        return catalog;
    }

    /**
     * Dataset and catalog read together.
     *
     * @return current dataset, or null when none is loaded
     */
    public synchronized LoadedDataset currentDataset() {
        return dataset == null ? null : new LoadedDataset(dataset, catalog);
    }

    public synchronized boolean hasDataset() {
        return dataset != null;
    }

    /**
     * Installs a new dataset version.
     *
     * @param loaded dataset and catalog
     * @throws JobActiveException when a job is pending or running
     */
    public synchronized void replaceDataset(LoadedDataset loaded) {
        Optional<AnalysisJob> active = activeJob();
        if (active.isPresent()) {
            throw new JobActiveException("Cannot replace the dataset while an analysis is running", active.get().getId());
        }
        this.dataset = loaded.dataset();
        this.catalog = loaded.catalog();
    }

    /**
     * Admits a job as the session's active job.
     *
     * @param job new job
     * @param maxTracked number of jobs kept for polling; older finished jobs are forgotten
     * @throws JobActiveException when another job is pending or running
     */
    public synchronized void beginJob(AnalysisJob job, int maxTracked) {
        Optional<AnalysisJob> active = activeJob();
        if (active.isPresent()) {
            throw new JobActiveException("An analysis is already running for this session", active.get().getId());
        }
        recentJobs.put(job.getId(), job);
        activeJobId = job.getId();
        Iterator<AnalysisJob> it = recentJobs.values().iterator();
        while (recentJobs.size() > maxTracked && it.hasNext()) {
            AnalysisJob oldest = it.next();
            if (!oldest.getId().equals(activeJobId)) {
                it.remove();
            }
        }
    }

    public synchronized void releaseJob(String jobId) {
        if (jobId != null && jobId.equals(activeJobId)) {
            activeJobId = null;
        }
    }

    public synchronized Optional<AnalysisJob> findJob(String jobId) {
        return Optional.ofNullable(jobId == null ? null : recentJobs.get(jobId));
    }

    public synchronized Optional<AnalysisJob> activeJob() {
        if (activeJobId == null) {
            return Optional.empty();
        }
        AnalysisJob job = recentJobs.get(activeJobId);
        return job != null && job.isActive() ? Optional.of(job) : Optional.empty();
    }

    public synchronized List<AnalysisJob> recentJobs() {
        return new ArrayList<>(recentJobs.values());
    }

    /**
     * Drops the dataset and job references when the session ends.
     */
    synchronized void release() {
        activeJob().ifPresent(AnalysisJob::requestCancel);
        dataset = null;
        catalog = null;
        activeJobId = null;
        recentJobs.clear();
    }
}
