package com.askdata.service;

import com.askdata.TestDatasets;
import com.askdata.history.HistoryEntry;
import com.askdata.history.InMemoryHistoryStore;
import com.askdata.job.AnalysisJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    private MutableClock clock;
    private InMemoryHistoryStore historyStore;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        historyStore = new InMemoryHistoryStore(5);
        manager = new SessionManager(historyStore, 30, 24, clock);
    }

    @Test
    void testCreateSessionWithDataset() {
        AnalysisSession session = manager.createSession(TestDatasets.sales());

        assertNotNull(session.getSessionId());
        assertTrue(session.hasDataset());
        assertEquals(10, session.getDataset().rowCount());
        assertEquals(session.getDataset().getVersion(), session.getCatalog().getDatasetVersion());
        assertEquals(1, manager.sessionCount());
    }

    @Test
    void testCreateSessionWithoutDataset() {
        AnalysisSession session = manager.createSession(null);

        assertFalse(session.hasDataset());
        assertNull(session.currentDataset());
    }

    @Test
    void testIdleExpiry() {
        String sessionId = manager.createSession(TestDatasets.sales()).getSessionId();

        clock.advance(Duration.ofMinutes(20));
        assertTrue(manager.getSession(sessionId).isPresent());

        clock.advance(Duration.ofMinutes(20));
        assertTrue(manager.getSession(sessionId).isPresent());

        clock.advance(Duration.ofMinutes(31));
        assertTrue(manager.getSession(sessionId).isEmpty());
        assertEquals(0, manager.sessionCount());
    }

    @Test
    void testLifetimeExpiry() {
        String sessionId = manager.createSession(TestDatasets.sales()).getSessionId();

        // kept busy, but 49 * 29 minutes is still inside the 24 hour lifetime
        for (int i = 0; i < 49; i++) {
            clock.advance(Duration.ofMinutes(29));
            assertTrue(manager.getSession(sessionId).isPresent());
        }
        clock.advance(Duration.ofMinutes(29));
        assertThrows(SessionNotFoundException.class, () -> manager.requireSession(sessionId));
    }

    @Test
    void testCleanupRemovesExpiredSessions() {
        manager.createSession(TestDatasets.sales());
        clock.advance(Duration.ofMinutes(10));
        String fresh = manager.createSession(null).getSessionId();

        clock.advance(Duration.ofMinutes(25));
        manager.cleanupExpiredSessions();

        assertEquals(1, manager.sessionCount());
        assertTrue(manager.getSession(fresh).isPresent());
    }

    @Test
    void testTerminateClearsHistoryAndCancelsActiveJob() {
        AnalysisSession session = manager.createSession(TestDatasets.sales());
        String sessionId = session.getSessionId();
        historyStore.append(sessionId, HistoryEntry.builder().entryId("e1").query("total sales").build());
        AnalysisJob job = new AnalysisJob("job-1", sessionId, "total sales", true);
        session.beginJob(job, 20);

        manager.terminateSession(sessionId);

        assertTrue(job.isCancelRequested());
        assertFalse(session.hasDataset());
        assertTrue(historyStore.list(sessionId).isEmpty());
        assertThrows(SessionNotFoundException.class, () -> manager.requireSession(sessionId));
    }

    @Test
    void testUnknownAndNullSessions() {
        assertTrue(manager.getSession(null).isEmpty());
        assertTrue(manager.getSession("missing").isEmpty());
        assertThrows(SessionNotFoundException.class, () -> manager.requireSession("missing"));
        manager.terminateSession(null);
        manager.terminateSession("missing");
        assertEquals(0, manager.sessionCount());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
