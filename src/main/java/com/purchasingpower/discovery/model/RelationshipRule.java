package com.purchasingpower.discovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declares that an attribute of one entity type holds the id of another entity.
 *
 * <p>Mutable so that rules can be bound from {@code discovery.explicit.rules} in application.yml:
 * <pre>
 * discovery:
 *   explicit:
 *     rules:
 *       - source-type: Subscription
 *         field: customer_id
 *         target-type: Customer
 *         relationship: BELONGS_TO
 *         confidence: 0.95
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipRule {

    private String sourceType;
    private String field;
    private String targetType;
    private RelationshipType relationship;

    @Builder.Default
    private boolean bidirectional = false;

    @Builder.Default
    private double confidence = 0.9;

    /**
     * Unresolved references of required rules are logged at INFO instead of DEBUG.
     */
    @Builder.Default
    private boolean required = false;

    public boolean matches(Entity entity) {
        return entity != null
                && sourceType != null
                && sourceType.equals(entity.getType())
                && entity.hasAttribute(field);
    }

    public static RelationshipRule of(String sourceType, String field, String targetType,
                                      RelationshipType relationship, double confidence) {
        return RelationshipRule.builder()
                .sourceType(sourceType)
                .field(field)
                .targetType(targetType)
                .relationship(relationship)
                .confidence(confidence)
                .build();
    }
}
