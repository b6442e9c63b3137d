package com.hpcwatch.history;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UptimeFormatterTest {

    @Test
    void usesCoarsestNonZeroUnit() {
        assertEquals("3d 4h", UptimeFormatter.format(3 * 86_400 + 4 * 3_600 + 59));
        assertEquals("4h 12m", UptimeFormatter.format(4 * 3_600 + 12 * 60 + 5));
        assertEquals("12m", UptimeFormatter.format(12 * 60 + 30));
        assertEquals("0m", UptimeFormatter.format(59));
    }

    @Test
    void notAvailableWhenNeverObserved() {
        assertEquals("N/A", UptimeFormatter.format(0));
        assertEquals("N/A", UptimeFormatter.format(-5));
    }
}
