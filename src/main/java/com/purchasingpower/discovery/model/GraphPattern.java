package com.purchasingpower.discovery.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural motif found in the relationship graph.
 *
 * <p>{@link #getCentralEntity()} depends only on the scores, never on member order, so the
 * same graph always yields the same centre.
 */
@Getter
public class GraphPattern {

    private final PatternType patternType;
    private final List<Entity> entities;
    private final Map<String, Double> centralityScores;
    private final Map<String, Object> metadata;
    private final double importanceScore;

    @Builder
    protected GraphPattern(PatternType patternType,
                           List<Entity> entities,
                           Map<String, Double> centralityScores,
                           Map<String, Object> metadata,
                           double importanceScore) {
        this.patternType = patternType;
        this.entities = entities == null ? List.of() : ImmutableList.copyOf(entities);
        this.centralityScores = centralityScores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(centralityScores));
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.importanceScore = importanceScore;
    }

    public Optional<Entity> getCentralEntity() {
        return entities.stream()
                .filter(e -> centralityScores.containsKey(e.getId()))
                .max(Comparator.<Entity>comparingDouble(e -> centralityScores.get(e.getId()))
                        .thenComparing(Entity::getId, Comparator.reverseOrder()));
    }

    public int size() {
        return entities.size();
    }

    public boolean contains(String entityId) {
        return entities.stream().anyMatch(e -> e.getId().equals(entityId));
    }

    @Override
    public String toString() {
        return patternType + entities.stream().map(Entity::getId).toList().toString();
    }
}
