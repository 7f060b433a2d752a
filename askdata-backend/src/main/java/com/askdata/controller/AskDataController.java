package com.askdata.controller;

import com.askdata.api.AnalyzeRequest;
import com.askdata.api.AnalyzeResponse;
import com.askdata.api.CatalogResponse;
import com.askdata.api.DataInfoResponse;
import com.askdata.api.DatasetSummary;
import com.askdata.api.ErrorResponse;
import com.askdata.api.HistoryResponse;
import com.askdata.api.ReplayRequest;
import com.askdata.api.SessionResponse;
import com.askdata.history.HistoryStore;
import com.askdata.ingest.DatasetLoadException;
import com.askdata.ingest.DatasetLoader;
import com.askdata.ingest.LoadedDataset;
import com.askdata.job.AnalysisJobService;
import com.askdata.job.JobSnapshot;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.Dataset;
import com.askdata.service.AnalysisSession;
import com.askdata.service.SessionManager;
import com.askdata.util.JsonSafe;
import com.askdata.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class AskDataController {

    private static final Logger log = LoggerFactory.getLogger(AskDataController.class);

    private static final String TRACE_ID = TraceIdFilter.MDC_TRACE_ID;
    private static final int SAMPLE_ROWS = 5;

    private final SessionManager sessionManager;
    private final AnalysisJobService jobService;
    private final HistoryStore historyStore;
    private final DatasetLoader datasetLoader;
    private final String defaultDatasetPath;

    public AskDataController(
            SessionManager sessionManager,
            AnalysisJobService jobService,
            HistoryStore historyStore,
            DatasetLoader datasetLoader,
            @Value("${askdata.dataset.default-path:}") String defaultDatasetPath
    ) {
        this.sessionManager = sessionManager;
        this.jobService = jobService;
        this.historyStore = historyStore;
        this.datasetLoader = datasetLoader;
        this.defaultDatasetPath = defaultDatasetPath;
    }

    /**
     * Open a session, loading the uploaded CSV or the configured default dataset.
     *
     * POST /v1/sessions
     *
     * @param file optional CSV upload
     * @return session id, expiry and dataset summary
     */
    @PostMapping("/sessions")
    public ResponseEntity<SessionResponse> createSession(
            @RequestParam(value = "file", required = false) MultipartFile file
    ) {
        LoadedDataset initial = null;
        if (file != null && !file.isEmpty()) {
            initial = loadUpload(file);
        } else if (defaultDatasetPath != null && !defaultDatasetPath.isBlank()) {
            initial = datasetLoader.load(Paths.get(defaultDatasetPath.trim()));
        }

        AnalysisSession session = sessionManager.createSession(initial);
        return ResponseEntity.ok(SessionResponse.builder()
                .sessionId(session.getSessionId())
                .traceId(MDC.get(TRACE_ID))
                .expiresAt(session.getExpiresAt())
                .dataset(DatasetSummary.of(initial))
                .build());
    }

    /**
     * Replace the session's dataset. Rejected while an analysis is running.
     *
     * POST /v1/sessions/{session_id}/dataset
     */
    @PostMapping("/sessions/{session_id}/dataset")
    public ResponseEntity<SessionResponse> reloadDataset(
            @PathVariable("session_id") String sessionId,
            @RequestPart("file") MultipartFile file
    ) {
        AnalysisSession session = sessionManager.requireSession(sessionId);
        if (file.isEmpty()) {
            throw new DatasetLoadException("Uploaded file is empty");
        }
        LoadedDataset loaded = loadUpload(file);
        session.replaceDataset(loaded);
        log.info("Dataset replaced: session_id={}, source={}, version={}, trace_id={}",
                sessionId, loaded.dataset().getSourceName(), loaded.dataset().getVersion(), MDC.get(TRACE_ID));
        return ResponseEntity.ok(SessionResponse.builder()
                .sessionId(sessionId)
                .traceId(MDC.get(TRACE_ID))
                .expiresAt(session.getExpiresAt())
                .dataset(DatasetSummary.of(loaded))
                .build());
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Void> disconnect(@RequestParam("session_id") String sessionId) {
        log.info("Disconnect requested: session_id={}, trace_id={}", sessionId, MDC.get(TRACE_ID));
        sessionManager.terminateSession(sessionId);
        return ResponseEntity.ok().build();
    }

    /**
     * Check session validity.
     *
     * GET /v1/sessions/validate
     *
     * @param sessionId Session ID to validate
     * @return 200 if valid, 401 if missing/expired
     */
    @GetMapping("/sessions/validate")
    public ResponseEntity<?> validateSession(@RequestParam("session_id") String sessionId) {
        var sessionOpt = sessionManager.getSession(sessionId);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.builder()
                    .code("SESSION_EXPIRED")
                    .message("Session missing or expired")
                    .traceId(MDC.get(TRACE_ID))
                    .build());
        }
        return ResponseEntity.ok(Map.of("valid", "true"));
    }

    /**
     * Submit a question. The job runs in the background; poll {@code /v1/jobs/{job_id}} for progress.
     *
     * POST /v1/analyze
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        JobSnapshot job = jobService.submit(request.getSessionId(), request.getQuery().trim(), request.isEnableVisualization());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(AnalyzeResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    @GetMapping("/jobs/{job_id}")
    public ResponseEntity<JobSnapshot> getJob(
            @PathVariable("job_id") String jobId,
            @RequestParam("session_id") String sessionId
    ) {
        return ResponseEntity.ok(jobService.getJob(sessionId, jobId));
    }

    @PostMapping("/jobs/{job_id}/cancel")
    public ResponseEntity<JobSnapshot> cancelJob(
            @PathVariable("job_id") String jobId,
            @RequestParam("session_id") String sessionId
    ) {
        return ResponseEntity.ok(jobService.cancel(sessionId, jobId));
    }

    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> getHistory(@RequestParam("session_id") String sessionId) {
        sessionManager.requireSession(sessionId);
        return ResponseEntity.ok(HistoryResponse.builder()
                .sessionId(sessionId)
                .maxEntries(historyStore.maxEntries())
                .entries(historyStore.list(sessionId))
                .build());
    }

    @DeleteMapping("/history")
    public ResponseEntity<Map<String, String>> clearHistory(@RequestParam("session_id") String sessionId) {
        sessionManager.requireSession(sessionId);
        historyStore.clear(sessionId);
        log.info("History cleared: session_id={}, trace_id={}", sessionId, MDC.get(TRACE_ID));
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    /**
     * Re-run a stored question against the session's current dataset.
     *
     * POST /v1/history/replay
     */
    @PostMapping("/history/replay")
    public ResponseEntity<AnalyzeResponse> replay(@Valid @RequestBody ReplayRequest request) {
        JobSnapshot job = jobService.replay(request.getSessionId(), request.getEntryId(), request.isEnableVisualization());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(AnalyzeResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    @GetMapping("/catalog")
    public ResponseEntity<CatalogResponse> getCatalog(@RequestParam("session_id") String sessionId) {
        LoadedDataset loaded = requireDataset(sessionId);
        ColumnCatalog catalog = loaded.catalog();
        return ResponseEntity.ok(CatalogResponse.builder()
                .sessionId(sessionId)
                .datasetVersion(catalog.getDatasetVersion())
                .columns(catalog.asMap())
                .numericColumns(catalog.numericColumns())
                .categoricalColumns(catalog.categoricalColumns())
                .build());
    }

    @GetMapping("/data/info")
    public ResponseEntity<DataInfoResponse> getDataInfo(@RequestParam("session_id") String sessionId) {
        LoadedDataset loaded = requireDataset(sessionId);
        Dataset dataset = loaded.dataset();
        List<String> columns = dataset.getColumns();

        List<Map<String, Object>> sample = new ArrayList<>();
        for (int r = 0; r < Math.min(SAMPLE_ROWS, dataset.rowCount()); r++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), JsonSafe.toJsonSafe(dataset.value(r, c)));
            }
            sample.add(row);
        }

        Map<String, Long> missing = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            long count = 0;
            for (int r = 0; r < dataset.rowCount(); r++) {
                if (dataset.value(r, c) == null) {
                    count++;
                }
            }
            missing.put(columns.get(c), count);
        }

        return ResponseEntity.ok(DataInfoResponse.builder()
                .sessionId(sessionId)
                .sourceName(dataset.getSourceName())
                .datasetVersion(dataset.getVersion())
                .rows(dataset.rowCount())
                .columns(columns)
                .columnTypes(loaded.catalog().asMap())
                .sampleRows(sample)
                .missingValues(missing)
                .build());
    }

    private LoadedDataset requireDataset(String sessionId) {
        LoadedDataset loaded = sessionManager.requireSession(sessionId).currentDataset();
        if (loaded == null) {
            throw new IllegalArgumentException("No dataset loaded");
        }
        return loaded;
    }

    private LoadedDataset loadUpload(MultipartFile file) {
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.csv";
        try (InputStream in = file.getInputStream()) {
            return datasetLoader.load(name, in);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read uploaded file " + name, e);
        }
    }
}
