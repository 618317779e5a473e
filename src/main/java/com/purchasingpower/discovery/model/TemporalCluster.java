package com.purchasingpower.discovery.model;

import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Burst of events that happened close together in time.
 */
@Value
public class TemporalCluster {
    Instant start;
    Instant end;
    List<Event> events;

    public int size() {
        return events.size();
    }

    public Set<String> entityIds() {
        return events.stream()
                .map(Event::getEntityId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
