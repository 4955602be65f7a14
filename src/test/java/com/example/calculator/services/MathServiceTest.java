package com.example.calculator.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathServiceTest {

    @Test
    public void testFitsInInt() {
        assertTrue(MathService.fitsInInt(Integer.MAX_VALUE));
        assertTrue(MathService.fitsInInt(Integer.MIN_VALUE));
        assertFalse(MathService.fitsInInt(Integer.MAX_VALUE + 1L));
        assertFalse(MathService.fitsInInt(Integer.MIN_VALUE - 1L));
    }

    @Test
    public void testOverflowMessageNamesOperation() {
        OverflowException thrown = assertThrows(OverflowException.class,
                () -> MathService.multiply(Integer.MAX_VALUE, 2));
        assertEquals("Integer overflow: 2147483647 * 2", thrown.getMessage());
    }

    @Test
    public void testDivisionByZeroIsArithmeticException() {
        ArithmeticException thrown = assertThrows(ArithmeticException.class, () -> MathService.divide(0, 0));
        assertInstanceOf(DivisionByZeroException.class, thrown);
        assertEquals("Division by zero: 0 / 0", thrown.getMessage());
    }

    @Test
    public void testBoundaryResults() {
        assertEquals(Integer.MAX_VALUE, MathService.add(Integer.MAX_VALUE - 1, 1));
        assertEquals(Integer.MIN_VALUE, MathService.subtract(-1, Integer.MAX_VALUE));
        assertEquals(Integer.MIN_VALUE, MathService.multiply(-65536, 32768));
        assertEquals(Integer.MAX_VALUE, MathService.divide(-Integer.MAX_VALUE, -1));
    }
}
