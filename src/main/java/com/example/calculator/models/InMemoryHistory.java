package com.example.calculator.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only history kept in memory.
 * Safe to share between calculators on different threads.
 */
public class InMemoryHistory implements History {
    private final List<String> entries;

    /**
     * Creates an empty history
     */
    public InMemoryHistory() {
        this.entries = new ArrayList<>();
    }

    @Override
    public synchronized void record(String entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public synchronized List<String> getLastOperations(int n) {
        int available = entries.size();
        if (n < 0 || n > available) {
            throw new HistoryOutOfRangeException(n, available);
        }
        return List.copyOf(entries.subList(available - n, available));
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "InMemoryHistory(entries: " + size() + ")";
    }
}
