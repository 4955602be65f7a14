package com.example.calculator.services;

/**
 * Service class for overflow-checked integer arithmetic.
 * Every result is computed in {@code long} and range-checked before narrowing.
 */
public class MathService {

    private MathService() {
    }

    /**
     * Adds two integers
     * @param a first number
     * @param b second number
     * @return the sum
     * @throws OverflowException if the sum does not fit in an int
     */
    public static int add(int a, int b) {
        return narrow((long) a + b, a, "+", b);
    }

    /**
     * Subtracts b from a
     * @param a the minuend
     * @param b the subtrahend
     * @return the difference
     * @throws OverflowException if the difference does not fit in an int
     */
    public static int subtract(int a, int b) {
        return narrow((long) a - b, a, "-", b);
    }

    /**
     * Multiplies two integers
     * @throws OverflowException if the product does not fit in an int
     */
    public static int multiply(int a, int b) {
        return narrow((long) a * b, a, "*", b);
    }

    /**
     * Divides a by b, truncating toward zero
     * @throws DivisionByZeroException if b is zero
     * @throws OverflowException for {@code Integer.MIN_VALUE / -1}
     */
    public static int divide(int a, int b) {
        if (b == 0) {
            throw new DivisionByZeroException(a);
        }
        return narrow((long) a / b, a, "/", b);
    }

    /**
     * Checks whether a widened result is representable as an int
     */
    public static boolean fitsInInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static int narrow(long value, int a, String symbol, int b) {
        if (!fitsInInt(value)) {
            throw new OverflowException(a, symbol, b);
        }
        return (int) value;
    }
}
