package com.example.calculator.services;

/**
 * Thrown when the exact result of an operation is outside the int range.
 */
public class OverflowException extends ArithmeticException {

    public OverflowException(int a, String symbol, int b) {
        super("Integer overflow: " + a + " " + symbol + " " + b);
    }
}
