package com.example.calculator;

import com.example.calculator.models.History;
import com.example.calculator.models.Operation;

import java.util.Objects;

/**
 * Default calculator. Holds no state besides the shared history it logs to.
 */
public class SimpleCalculator implements Calculator {
    private volatile History history;

    /**
     * Creates a calculator that records into the given history
     */
    public SimpleCalculator(History history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    @Override
    public int add(int a, int b) {
        return applyOperation(Operation.ADD, a, b);
    }

    @Override
    public int subtract(int a, int b) {
        return applyOperation(Operation.SUBTRACT, a, b);
    }

    @Override
    public int multiply(int a, int b) {
        return applyOperation(Operation.MULTIPLY, a, b);
    }

    @Override
    public int divide(int a, int b) {
        return applyOperation(Operation.DIVIDE, a, b);
    }

    @Override
    public int applyOperation(Operation operation, int a, int b) {
        int result = operation.apply(a, b);
        history.record(operation.format(a, b, result));
        return result;
    }

    @Override
    public void setHistory(History history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    @Override
    public History getHistory() {
        return history;
    }

    @Override
    public String toString() {
        return "SimpleCalculator(history: " + history + ")";
    }
}
