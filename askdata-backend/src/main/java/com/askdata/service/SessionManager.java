package com.askdata.service;

import com.askdata.history.HistoryStore;
import com.askdata.ingest.LoadedDataset;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final HistoryStore historyStore;
    private final long idleTimeoutMinutes;
    private final long maxLifetimeHours;
    private final Clock clock;

    @Autowired
    public SessionManager(
            HistoryStore historyStore,
            @Value("${askdata.session.idle-timeout-minutes:30}") long idleTimeoutMinutes,
            @Value("${askdata.session.max-lifetime-hours:24}") long maxLifetimeHours
    ) {
        this(historyStore, idleTimeoutMinutes, maxLifetimeHours, Clock.systemDefaultZone());
        // Run cleanup task every 5 minutes
        scheduler.scheduleAtFixedRate(this::cleanupExpiredSessions, 5, 5, TimeUnit.MINUTES);
    }

    SessionManager(HistoryStore historyStore, long idleTimeoutMinutes, long maxLifetimeHours, Clock clock) {
        this.historyStore = historyStore;
        this.idleTimeoutMinutes = idleTimeoutMinutes;
        this.maxLifetimeHours = maxLifetimeHours;
        this.clock = clock;
    }

    /**
     * Opens a session, optionally with a dataset already loaded.
     *
     * @param initial dataset to install, or null
     * @return new session
     */
    public AnalysisSession createSession(LoadedDataset initial) {
        String sessionId = UUID.randomUUID().toString();
        OffsetDateTime now = OffsetDateTime.now(clock);
        AnalysisSession session = new AnalysisSession(sessionId, now, now.plusHours(maxLifetimeHours));
        if (initial != null) {
            session.replaceDataset(initial);
        }
        sessions.put(sessionId, session);
        log.info("Session created: session_id={}, dataset={}", sessionId,
                initial != null ? initial.dataset().getSourceName() : null);
        return session;
    }

    public Optional<AnalysisSession> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        AnalysisSession session = sessions.get(sessionId);
        if (session != null) {
            if (isSessionExpired(session)) {
                terminateSession(sessionId);
                return Optional.empty();
            }
            session.setLastAccessedAt(OffsetDateTime.now(clock));
            return Optional.of(session);
        }
        return Optional.empty();
    }

    /**
     * Looks up a live session.
     *
     * @param sessionId session identifier
     * @return session
     * @throws SessionNotFoundException when the session is unknown or expired
     */
    public AnalysisSession requireSession(String sessionId) {
        return getSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session missing or expired"));
    }

    /**
     * Ends a session: cancels its active job, drops its dataset and clears its history.
     *
     * @param sessionId session identifier
     */
    public void terminateSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        AnalysisSession removed = sessions.remove(sessionId);
        if (removed != null) {
            removed.release();
            historyStore.clear(sessionId);
            log.info("Session terminated: session_id={}", sessionId);
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private boolean isSessionExpired(AnalysisSession session) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean idleExpired = session.getLastAccessedAt().plusMinutes(idleTimeoutMinutes).isBefore(now);
        boolean lifeExpired = session.getExpiresAt().isBefore(now);
        return idleExpired || lifeExpired;
    }

    void cleanupExpiredSessions() {
        for (Map.Entry<String, AnalysisSession> entry : sessions.entrySet()) {
            if (isSessionExpired(entry.getValue())) {
                terminateSession(entry.getKey());
            }
        }
    }
}
