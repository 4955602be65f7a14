package com.example.calculator.models;

import com.example.calculator.services.MathService;

/**
 * The four arithmetic operations and their history symbols
 */
public enum Operation {
    ADD("+") {
        @Override
        public int apply(int a, int b) {
            return MathService.add(a, b);
        }
    },
    SUBTRACT("-") {
        @Override
        public int apply(int a, int b) {
            return MathService.subtract(a, b);
        }
    },
    MULTIPLY("*") {
        @Override
        public int apply(int a, int b) {
            return MathService.multiply(a, b);
        }
    },
    DIVIDE("/") {
        @Override
        public int apply(int a, int b) {
            return MathService.divide(a, b);
        }
    };

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Evaluates the operation with overflow and zero-divisor checks
     */
    public abstract int apply(int a, int b);

    public String getSymbol() {
        return symbol;
    }

    /**
     * Formats a history entry, e.g. {@code "20 + 30 = 50"}
     */
    public String format(int a, int b, int result) {
        return a + " " + symbol + " " + b + " = " + result;
    }
}
