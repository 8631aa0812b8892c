package io.platformvm.core.metrics;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class StakeGaugeTest {

    @Test
    void keepsFullPrecision() {
        StakeGauge gauge = new StakeGauge(new MetricDescriptor("platformvm", "total_staked", "Total staked"));
        BigDecimal huge = new BigDecimal("123456789012345678901234567890.000000001");

        gauge.set(huge);

        assertEquals(huge, gauge.value());
    }

    @Test
    void rejectsNegativeAndNull() {
        StakeGauge gauge = new StakeGauge(new MetricDescriptor("platformvm", "total_staked", "Total staked"));

        assertThrows(IllegalArgumentException.class, () -> gauge.set(new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class, () -> gauge.set(null));
        assertEquals(BigDecimal.ZERO, gauge.value());
    }

    @Test
    void enforcesUpperBound() {
        StakeGauge gauge = new StakeGauge(
                new MetricDescriptor("platformvm", "percent_connected", "Percent connected"), BigDecimal.ONE);

        gauge.set(new BigDecimal("0.75"));
        assertThrows(IllegalArgumentException.class, () -> gauge.set(new BigDecimal("1.01")));
        assertEquals(new BigDecimal("0.75"), gauge.value());
    }
}
