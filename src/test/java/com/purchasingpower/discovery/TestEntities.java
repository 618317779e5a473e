package com.purchasingpower.discovery;

import com.purchasingpower.discovery.model.AttributeValue;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.RelationshipType;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Small entity graphs shared by the service tests.
 */
public final class TestEntities {

    /**
     * Runs tasks on the calling thread so tests stay deterministic.
     */
    public static final Executor DIRECT = Runnable::run;

    private TestEntities() {
    }

    public static Entity entity(String id, String type, String name) {
        return Entity.of(id, type, name);
    }

    public static Entity withReference(Entity entity, String field, String reference) {
        return entity.toBuilder().attribute(field, AttributeValue.of(reference)).build();
    }

    public static Relationship edge(Entity source, Entity target, RelationshipType type, double confidence) {
        return Relationship.builder()
                .source(source)
                .target(target)
                .relationshipType(type)
                .confidence(confidence)
                .evidence(List.of("test edge"))
                .build();
    }

    public static Relationship bidirectionalEdge(Entity source, Entity target, RelationshipType type, double confidence) {
        return edge(source, target, type, confidence).toBuilder()
                .direction(RelationshipDirection.BIDIRECTIONAL)
                .build();
    }
}
