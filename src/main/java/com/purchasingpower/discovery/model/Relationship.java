package com.purchasingpower.discovery.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed, directed edge between two entities, with the evidence that supports it.
 *
 * <p>For multi-hop relationships {@link #getPath()} holds the full node sequence from
 * source to target (at least three entities); for every other relationship it is empty.
 */
@Value
public class Relationship {

    String id;
    Entity source;
    Entity target;
    RelationshipType relationshipType;
    RelationshipDirection direction;
    RelationshipStrength strength;
    double confidence;
    List<String> evidence;
    TemporalAspect temporalAspect;
    List<Entity> path;
    Map<String, Object> metadata;
    Instant discoveredAt;

    @Builder(toBuilder = true)
    private Relationship(String id,
                         Entity source,
                         Entity target,
                         RelationshipType relationshipType,
                         RelationshipDirection direction,
                         RelationshipStrength strength,
                         double confidence,
                         List<String> evidence,
                         TemporalAspect temporalAspect,
                         List<Entity> path,
                         Map<String, Object> metadata,
                         Instant discoveredAt) {
        checkNotNull(source, "source");
        checkNotNull(target, "target");
        checkNotNull(relationshipType, "relationshipType");
        checkArgument(confidence >= 0.0 && confidence <= 1.0,
                "confidence must be within [0, 1], was %s", confidence);

        List<Entity> safePath = path == null ? List.of() : path;
        if (!safePath.isEmpty()) {
            checkArgument(safePath.size() >= 3, "path must hold at least 3 entities, was %s", safePath.size());
            checkArgument(safePath.get(0).getId().equals(source.getId()), "path must start at the source");
            checkArgument(safePath.get(safePath.size() - 1).getId().equals(target.getId()), "path must end at the target");
        }

        this.id = id != null ? id : UUID.randomUUID().toString();
        this.source = source;
        this.target = target;
        this.relationshipType = relationshipType;
        this.direction = direction != null ? direction : RelationshipDirection.UNIDIRECTIONAL;
        this.strength = strength != null ? strength : RelationshipStrength.fromConfidence(confidence);
        this.confidence = confidence;
        this.evidence = evidence == null ? List.of() : ImmutableList.copyOf(evidence);
        this.temporalAspect = temporalAspect;
        this.path = ImmutableList.copyOf(safePath);
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.discoveredAt = discoveredAt != null ? discoveredAt : Instant.now();
    }

    public int getPathLength() {
        return path.size();
    }

    public boolean isBidirectional() {
        return direction == RelationshipDirection.BIDIRECTIONAL;
    }

    /**
     * Identity used for deduplication: same endpoints (in order) and same type.
     */
    public Key key() {
        return new Key(source.getId(), target.getId(), relationshipType);
    }

    public boolean involves(String entityId) {
        return source.getId().equals(entityId) || target.getId().equals(entityId);
    }

    public record Key(String sourceId, String targetId, RelationshipType type) {
    }

    @Override
    public String toString() {
        return source.getId() + " -[" + relationshipType + " " + String.format(Locale.ROOT, "%.2f", confidence) + "]-> " + target.getId();
    }
}
