package com.hpcwatch.transform;

import com.hpcwatch.transform.RangeSeriesMerger.Column;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.LongFunction;

import static com.hpcwatch.support.Series.range;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RangeSeriesMergerTest {

    // 2026-03-10T12:00:00Z
    private static final long START = 1_773_144_000L;

    private final LongFunction<String> labels = RangeLabels.general("24h", ZoneOffset.UTC);

    @Test
    void firstColumnDrivesRowsAndOthersFillIn() {
        List<Map<String, Object>> rows = RangeSeriesMerger.merge(List.of(
                new Column("gpu", List.of(range(START, 300, "51.26", "60.04", "70")), RangeSeriesMerger::oneDecimal),
                new Column("memory", List.of(range(START + 300, 300, "40", "45", "99")), RangeSeriesMerger::oneDecimal)),
                labels);

        assertEquals(3, rows.size());
        assertEquals(Map.of("timestamp", "12:00", "gpu", 51.3, "memory", 0.0), rows.get(0));
        assertEquals(Map.of("timestamp", "12:05", "gpu", 60.0, "memory", 40.0), rows.get(1));
        assertEquals(Map.of("timestamp", "12:10", "gpu", 70.0, "memory", 45.0), rows.get(2));
    }

    @Test
    void emptyDriverGivesNoRows() {
        List<Map<String, Object>> rows = RangeSeriesMerger.merge(List.of(
                new Column("running", List.of(), RangeSeriesMerger::whole),
                new Column("queued", List.of(range(START, 300, "4")), RangeSeriesMerger::whole)),
                labels);

        assertEquals(List.of(), rows);
    }

    @Test
    void unreadablePointsBecomeZero() {
        List<Map<String, Object>> rows = RangeSeriesMerger.merge(List.of(
                new Column("total", List.of(range(START, 3600, "1520.6", "NaN")), RangeSeriesMerger::rounded)),
                RangeLabels.power("1d", ZoneOffset.UTC));

        assertEquals(1521L, rows.get(0).get("total"));
        assertEquals(0L, rows.get(1).get("total"));
    }

    @Test
    void labelsCoarsenWithRange() {
        assertEquals("Mar 10", RangeLabels.general("30d", ZoneOffset.UTC).apply(START));
        assertEquals("Tue 12", RangeLabels.power("7d", ZoneOffset.UTC).apply(START));
        assertEquals("Mar 10", RangeLabels.power("yesterday", ZoneOffset.UTC).apply(START));
    }
}
