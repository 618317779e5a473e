package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipType;

import java.util.List;
import java.util.Map;

/**
 * Result of a discovery run.
 */
public interface DiscoveryResult {
    List<Relationship> getRelationships();
    List<GraphPattern> getPatterns();

    /**
     * Relationships contributed by each strategy, before deduplication and filtering.
     */
    Map<String, Integer> getStrategyCounts();

    int getSkippedEntities();
    long getDurationMs();
    List<String> getErrors();

    /**
     * Relationships touching an entity.
     *
     * @param type     restricts the relationship type, or null for any
     * @param asSource include relationships where the entity is the source
     * @param asTarget include relationships where the entity is the target
     */
    default List<Relationship> relationshipsFor(String entityId, RelationshipType type, boolean asSource, boolean asTarget) {
        return getRelationships().stream()
                .filter(r -> type == null || r.getRelationshipType() == type)
                .filter(r -> (asSource && r.getSource().getId().equals(entityId))
                        || (asTarget && r.getTarget().getId().equals(entityId)))
                .toList();
    }
}
