package com.example.calculator.models;

import java.util.List;

/**
 * Interface for operation logs
 */
public interface History {
    /**
     * Appends an entry to the end of the log
     */
    void record(String entry);

    /**
     * Gets the last n entries, oldest first
     * @param n number of entries wanted
     * @return an unmodifiable list of exactly n entries
     * @throws HistoryOutOfRangeException if n is negative or more than {@link #size()}
     */
    List<String> getLastOperations(int n);

    /**
     * Gets the number of recorded entries
     */
    int size();

    /**
     * Checks if anything has been recorded
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
