package com.purchasingpower.discovery.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.discovery.exception.DiscoveryException;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts discovery output into plain maps and JSON for the persistence layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipExporter {

    private final ObjectMapper objectMapper;

    public Map<String, Object> toMap(Relationship relationship) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", relationship.getId());
        map.put("source_id", relationship.getSource().getId());
        map.put("source_type", relationship.getSource().getType());
        map.put("target_id", relationship.getTarget().getId());
        map.put("target_type", relationship.getTarget().getType());
        map.put("relationship_type", relationship.getRelationshipType().name());
        map.put("category", categoryLabel(relationship.getRelationshipType()));
        map.put("direction", relationship.getDirection().name());
        map.put("strength", relationship.getStrength().name());
        map.put("confidence", relationship.getConfidence());
        map.put("evidence", relationship.getEvidence());
        map.put("temporal_aspect", relationship.getTemporalAspect() == null ? null : relationship.getTemporalAspect().name());
        map.put("path", relationship.getPath().stream().map(Entity::getId).toList());
        map.put("path_length", relationship.getPathLength());
        map.put("metadata", relationship.getMetadata());
        map.put("discovered_at", relationship.getDiscoveredAt().toString());
        return map;
    }

    public Map<String, Object> toMap(GraphPattern pattern) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("pattern_type", pattern.getPatternType().name());
        map.put("entities", pattern.getEntities().stream().map(Entity::getId).toList());
        map.put("central_entity", pattern.getCentralEntity().map(Entity::getId).orElse(null));
        map.put("centrality_scores", pattern.getCentralityScores());
        map.put("importance_score", pattern.getImportanceScore());
        map.put("metadata", pattern.getMetadata());
        return map;
    }

    public String toJson(Collection<Relationship> relationships) {
        List<Map<String, Object>> rows = relationships.stream().map(this::toMap).toList();
        try {
            return objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} relationships: {}", rows.size(), e.getMessage());
            throw new DiscoveryException("export", "Relationship serialization failed", e);
        }
    }

    /**
     * Label used by the graph store to pick the edge collection.
     */
    static String categoryLabel(RelationshipType type) {
        return switch (type.getCategory()) {
            case EXPLICIT -> "explicit";
            case INFERRED -> "inferred";
            case MULTI_HOP -> "multi_hop";
        };
    }
}
