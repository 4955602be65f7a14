package com.example.calculator;

import com.example.calculator.models.History;
import com.example.calculator.models.Operation;

/**
 * Calculator with overflow-checked integer arithmetic.
 * Each successful operation is recorded in the attached {@link History}.
 */
public interface Calculator {

    /**
     * Adds two integers
     * @param a first number
     * @param b second number
     * @return the sum
     * @throws com.example.calculator.services.OverflowException if the sum overflows
     */
    int add(int a, int b);

    /**
     * Subtracts b from a
     * @param a the minuend
     * @param b the subtrahend
     * @return the difference
     * @throws com.example.calculator.services.OverflowException if the difference overflows
     */
    int subtract(int a, int b);

    /**
     * Multiplies two numbers
     * @throws com.example.calculator.services.OverflowException if the product overflows
     */
    int multiply(int a, int b);

    /**
     * Divides a by b, truncating toward zero
     * @throws com.example.calculator.services.DivisionByZeroException if b is zero
     * @throws com.example.calculator.services.OverflowException for {@code Integer.MIN_VALUE / -1}
     */
    int divide(int a, int b);

    /**
     * Applies an operation to two numbers and records it
     */
    int applyOperation(Operation operation, int a, int b);

    /**
     * Replaces the history that later operations are recorded in
     */
    void setHistory(History history);

    /**
     * Gets the history currently attached
     */
    History getHistory();
}
