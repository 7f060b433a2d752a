package com.askdata.history;

import java.util.List;
import java.util.Optional;

/**
 * Bounded, per-session record of completed analyses.
 */
public interface HistoryStore {

    /**
     * Appends an entry, evicting the oldest ones beyond the bound.
     *
     * @param sessionId session identifier
     * @param entry completed analysis
     */
    void append(String sessionId, HistoryEntry entry);

    /**
     * Lists entries for a session.
     *
     * @param sessionId session identifier
     * @return entries, most recent first
     */
    List<HistoryEntry> list(String sessionId);

    Optional<HistoryEntry> find(String sessionId, String entryId);

    void clear(String sessionId);

    int maxEntries();
}
