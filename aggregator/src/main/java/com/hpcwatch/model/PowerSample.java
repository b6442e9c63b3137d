package com.hpcwatch.model;

import java.time.Instant;

public record PowerSample(String entityId, Instant observedAt, long watts) {
}
