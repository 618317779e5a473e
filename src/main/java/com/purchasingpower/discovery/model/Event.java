package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A timestamped observation about one entity, optionally carrying a numeric value.
 */
@Value
@Builder
public class Event {

    String entityId;
    String eventType;
    Instant timestamp;
    Double value;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    /**
     * Value contributed to a daily series; an event without a value counts once.
     */
    public double effectiveValue() {
        return value != null ? value : 1.0;
    }

    public long daysBetween(Event other) {
        return Math.abs(Duration.between(timestamp, other.timestamp).toDays());
    }

    public static Event of(String entityId, String eventType, Instant timestamp, Double value) {
        return Event.builder()
                .entityId(entityId)
                .eventType(eventType)
                .timestamp(timestamp)
                .value(value)
                .build();
    }
}
