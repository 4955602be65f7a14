package com.example.calculator.services;

/**
 * Thrown when an integer is divided by zero.
 */
public class DivisionByZeroException extends ArithmeticException {

    private final int dividend;

    public DivisionByZeroException(int dividend) {
        super("Division by zero: " + dividend + " / 0");
        this.dividend = dividend;
    }

    public int getDividend() {
        return dividend;
    }
}
