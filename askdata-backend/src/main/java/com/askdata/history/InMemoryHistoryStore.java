package com.askdata.history;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps recent analyses per session in memory, newest first, dropping the oldest past the bound.
 */
@Service
public class InMemoryHistoryStore implements HistoryStore {

    public static final int DEFAULT_MAX_ENTRIES = 20;

    private final Map<String, Deque<HistoryEntry>> buffers = new ConcurrentHashMap<>();
    private final int maxEntries;

    public InMemoryHistoryStore(@Value("${askdata.history.max-entries:20}") int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("askdata.history.max-entries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public void append(String sessionId, HistoryEntry entry) {
        if (sessionId == null || sessionId.isBlank() || entry == null) {
            return;
        }
        Deque<HistoryEntry> deque = buffers.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addFirst(entry);
            while (deque.size() > maxEntries) {
                deque.removeLast();
            }
        }
    }

    @Override
    public List<HistoryEntry> list(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return List.of();
        }
        Deque<HistoryEntry> deque = buffers.get(sessionId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return new ArrayList<>(deque);
        }
    }

    @Override
    public Optional<HistoryEntry> find(String sessionId, String entryId) {
        if (entryId == null) {
            return Optional.empty();
        }
        for (HistoryEntry entry : list(sessionId)) {
            if (entryId.equals(entry.getEntryId())) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    @Override
    public void clear(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        buffers.remove(sessionId);
    }

    @Override
    public int maxEntries() {
        return maxEntries;
    }
}
