package com.purchasingpower.discovery.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Pattern whose members work together, scored by the strength of the ties between them.
 */
@Getter
public class CollaborationPattern extends GraphPattern {

    private final double collaborationStrength;
    private final List<String> supportingEvidence;
    private final String collaborationType;

    @Builder(builderMethodName = "collaborationBuilder")
    private CollaborationPattern(PatternType patternType,
                                 List<Entity> entities,
                                 Map<String, Double> centralityScores,
                                 Map<String, Object> metadata,
                                 double importanceScore,
                                 double collaborationStrength,
                                 List<String> supportingEvidence,
                                 String collaborationType) {
        super(patternType, entities, centralityScores, metadata, importanceScore);
        this.collaborationStrength = collaborationStrength;
        this.supportingEvidence = supportingEvidence == null ? List.of() : ImmutableList.copyOf(supportingEvidence);
        this.collaborationType = collaborationType;
    }

    public boolean indicatesCollaboration() {
        return collaborationStrength > 0.5;
    }
}
