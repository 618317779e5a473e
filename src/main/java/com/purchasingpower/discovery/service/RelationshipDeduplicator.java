package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses relationships sharing source, target and type, keeping the most confident one.
 *
 * <p>The survivor takes the position of the first occurrence, so applying the operation
 * twice gives the same list as applying it once.
 */
public final class RelationshipDeduplicator {

    private RelationshipDeduplicator() {
    }

    public static List<Relationship> deduplicate(Collection<Relationship> relationships) {
        Map<Relationship.Key, Relationship> best = new LinkedHashMap<>();
        for (Relationship relationship : relationships) {
            best.merge(relationship.key(), relationship,
                    (kept, candidate) -> candidate.getConfidence() > kept.getConfidence() ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }
}
