package com.example.calculator.models;

/**
 * Thrown when more history entries are requested than have been recorded.
 */
public class HistoryOutOfRangeException extends IndexOutOfBoundsException {

    private final int requested;
    private final int available;

    public HistoryOutOfRangeException(int requested, int available) {
        super("Requested " + requested + " operations but history holds " + available);
        this.requested = requested;
        this.available = available;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
