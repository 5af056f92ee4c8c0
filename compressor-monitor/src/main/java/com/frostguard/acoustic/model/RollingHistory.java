package com.frostguard.acoustic.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Chronological ring buffer of observations. Appending at capacity evicts the
 * oldest entry. All access goes through the buffer's own monitor.
 */
public class RollingHistory {

    private final int capacity;
    private final Deque<HistoryEntry> entries;

    public RollingHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    public synchronized void append(Instant timestamp, FeatureVector features, boolean anomaly) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(new HistoryEntry(timestamp, features, anomaly));
    }

    /** Copy of the newest {@code limit} entries, oldest first. */
    public synchronized List<HistoryEntry> recent(int limit) {
        int skip = Math.max(0, entries.size() - limit);
        List<HistoryEntry> out = new ArrayList<>(entries.size() - skip);
        int i = 0;
        for (HistoryEntry entry : entries) {
            if (i++ >= skip) {
                out.add(entry);
            }
        }
        return out;
    }

    public synchronized List<HistoryEntry> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
