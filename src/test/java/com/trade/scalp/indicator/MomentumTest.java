package com.trade.scalp.indicator;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MomentumTest {

    @Test
    void testMomentum_Calculate() {
        Momentum momentum = new Momentum(2);
        List<BigDecimal> values = List.of(
                new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("4"), new BigDecimal("7"));

        List<BigDecimal> result = momentum.calculate(values);

        assertEquals(2, result.size());
        assertEquals(0, new BigDecimal("3").compareTo(result.get(0)));
        assertEquals(0, new BigDecimal("5").compareTo(result.get(1)));
    }

    @Test
    void testMomentum_InsufficientData() {
        Momentum momentum = new Momentum(3);
        assertEquals(4, momentum.requiredPoints());
        assertThrows(IllegalArgumentException.class,
                () -> momentum.calculate(List.of(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE)));
    }
}
