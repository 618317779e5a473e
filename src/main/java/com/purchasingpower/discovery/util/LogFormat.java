package com.purchasingpower.discovery.util;

import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Helpers that keep discovery log lines short and consistent.
 */
public final class LogFormat {

    private LogFormat() {
    }

    /**
     * Maps with more entries than this are logged as a size only.
     */
    private static final int MAX_MAP_ENTRIES = 5;

    /**
     * Cuts {@code text} to {@code maxLength} chars and notes how much was dropped.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        int dropped = text.length() - maxLength;
        return dropped <= 0 ? text : text.substring(0, maxLength) + "... (+" + dropped + " chars)";
    }

    /**
     * Small maps in full, larger ones as an entry count.
     */
    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        return map.size() <= MAX_MAP_ENTRIES ? map.toString() : "{" + map.size() + " entries}";
    }

    public static Map<RelationshipType, Integer> countByType(Collection<Relationship> relationships) {
        Map<RelationshipType, Integer> counts = new EnumMap<>(RelationshipType.class);
        for (Relationship relationship : relationships) {
            counts.merge(relationship.getRelationshipType(), 1, Integer::sum);
        }
        return counts;
    }
}
