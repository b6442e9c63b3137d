package com.hpcwatch.transform;

import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.HealthSample;
import com.hpcwatch.model.HealthStatus;
import com.hpcwatch.source.MetricPoint;
import com.hpcwatch.source.MetricSeries;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.hpcwatch.support.Series.instant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class HealthTransformerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final HealthTransformer transformer = new HealthTransformer();
    private final EntityUniverse universe = EntityUniverse.generate("hopper-", 4, 2);

    @Test
    void everyUniverseEntityIsPresentInOrder() {
        Map<String, HealthSample> samples = transformer.transform(
                List.of(instant("instance", "hopper-03.cluster.local:9100", "3")),
                List.of(),
                universe,
                NOW);

        assertEquals(universe.ids(), List.copyOf(samples.keySet()));
        assertEquals(HealthStatus.OK, samples.get("hopper-03").getStatus());
        assertEquals(HealthStatus.NO_DATA_LABEL, samples.get("hopper-01").getStatusLabel());
        assertFalse(samples.get("hopper-01").isKnown());
    }

    @Test
    void mapsStatusCodesAndUptime() {
        Map<String, HealthSample> samples = transformer.transform(
                List.of(
                        instant("instance", "hopper-01:9100", "4"),
                        instant("node", "hopper-02", "6"),
                        instant("host", "hopper-03.cluster", "1")),
                List.of(instant("instance", "hopper-01:9100", "7200")),
                universe,
                NOW);

        HealthSample first = samples.get("hopper-01");
        assertEquals(HealthStatus.WARNING, first.getStatus());
        assertEquals("Warning", first.getStatusLabel());
        assertEquals(4, first.getStatusValue());
        assertEquals(7200, first.getUptimeSeconds());
        assertEquals(NOW, first.getObservedAt());

        assertEquals(HealthStatus.NON_RECOVERABLE, samples.get("hopper-02").getStatus());
        assertEquals(HealthStatus.OTHER, samples.get("hopper-03").getStatus());
        assertEquals(0, samples.get("hopper-02").getUptimeSeconds());
    }

    @Test
    void unreadableValueDegradesOnlyThatEntity() {
        Map<String, HealthSample> samples = transformer.transform(
                List.of(
                        instant("instance", "hopper-01", "NaN"),
                        new MetricSeries(Map.of("instance", "hopper-02"), List.of(new MetricPoint(0, null))),
                        instant("instance", "hopper-03", "5")),
                List.of(),
                universe,
                NOW);

        assertEquals(HealthStatus.NO_DATA_CODE, samples.get("hopper-01").getStatusValue());
        assertEquals(HealthStatus.NO_DATA_CODE, samples.get("hopper-02").getStatusValue());
        assertEquals(HealthStatus.CRITICAL, samples.get("hopper-03").getStatus());
    }

    @Test
    void unrecognisedCodeIsUnknownButKeepsRawValue() {
        Map<String, HealthSample> samples = transformer.transform(
                List.of(
                        instant("instance", "hopper-01:9100", "4294967299"),
                        instant("instance", "hopper-02:9100", "5.5"),
                        instant("instance", "hopper-04", "9")),
                List.of(), universe, NOW);

        HealthSample sample = samples.get("hopper-04");
        assertEquals(HealthStatus.UNKNOWN, sample.getStatus());
        assertEquals("Unknown", sample.getStatusLabel());
        assertEquals(9, sample.getStatusValue());

        for (String entity : List.of("hopper-01", "hopper-02")) {
            assertEquals(HealthStatus.UNKNOWN, samples.get(entity).getStatus(), entity);
            assertEquals("Unknown", samples.get(entity).getStatusLabel(), entity);
            assertFalse(samples.get(entity).isKnown(), entity);
        }
    }

    @Test
    void ignoresSeriesOutsideUniverse() {
        Map<String, HealthSample> samples = transformer.transform(
                List.of(instant("instance", "login-01:9100", "5")), List.of(), universe, NOW);

        assertEquals(4, samples.size());
        assertFalse(samples.containsKey("login-01"));
    }
}
