package com.purchasingpower.discovery.service.temporal.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties.Temporal.Aggregation;
import com.purchasingpower.discovery.model.Event;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Events of one entity bucketed per UTC day. Days without events are absent, not zero.
 */
final class DailySeries {

    private final NavigableMap<Long, Double> values;

    private DailySeries(NavigableMap<Long, Double> values) {
        this.values = values;
    }

    static DailySeries of(Collection<Event> events, Aggregation aggregation) {
        NavigableMap<Long, Double> sums = new TreeMap<>();
        NavigableMap<Long, Integer> counts = new TreeMap<>();
        for (Event event : events) {
            long day = epochDay(event);
            sums.merge(day, event.effectiveValue(), Double::sum);
            counts.merge(day, 1, Integer::sum);
        }

        NavigableMap<Long, Double> values = new TreeMap<>();
        for (Map.Entry<Long, Double> entry : sums.entrySet()) {
            int count = counts.get(entry.getKey());
            double value = switch (aggregation) {
                case SUM -> entry.getValue();
                case MEAN -> entry.getValue() / count;
                case COUNT -> count;
            };
            values.put(entry.getKey(), value);
        }
        return new DailySeries(values);
    }

    static long epochDay(Event event) {
        return LocalDate.ofInstant(event.getTimestamp(), ZoneOffset.UTC).toEpochDay();
    }

    DailySeries from(long firstDay) {
        return new DailySeries(values.tailMap(firstDay, true));
    }

    DailySeries between(long firstDay, long lastDay) {
        return new DailySeries(values.subMap(firstDay, true, lastDay, true));
    }

    boolean isEmpty() {
        return values.isEmpty();
    }

    long firstDay() {
        return values.firstKey();
    }

    long lastDay() {
        return values.lastKey();
    }

    Double valueOn(long day) {
        return values.get(day);
    }

    NavigableMap<Long, Double> values() {
        return values;
    }
}
