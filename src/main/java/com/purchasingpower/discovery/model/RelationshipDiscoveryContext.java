package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Caller-supplied filter applied to the merged discovery output.
 */
@Value
@Builder
public class RelationshipDiscoveryContext {

    @Builder.Default
    double minConfidence = 0.0;

    @Singular
    Set<RelationshipType> excludeTypes;

    /**
     * When non-empty, only relationships touching one of these entity ids are kept.
     */
    @Singular("focusEntity")
    Set<String> focusEntities;

    public static RelationshipDiscoveryContext permissive() {
        return RelationshipDiscoveryContext.builder().build();
    }

    public boolean shouldIncludeRelationship(Relationship relationship) {
        if (relationship.getConfidence() < minConfidence) {
            return false;
        }
        if (excludeTypes.contains(relationship.getRelationshipType())) {
            return false;
        }
        return focusEntities.isEmpty()
                || focusEntities.contains(relationship.getSource().getId())
                || focusEntities.contains(relationship.getTarget().getId());
    }
}
