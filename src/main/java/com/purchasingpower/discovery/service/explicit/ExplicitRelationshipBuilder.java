package com.purchasingpower.discovery.service.explicit;

import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipRule;

import java.util.Collection;
import java.util.List;

/**
 * Turns foreign-key attributes into relationships.
 *
 * <p>A reference that cannot be resolved against the supplied entities is skipped,
 * never reported as an error.
 */
public interface ExplicitRelationshipBuilder {

    /**
     * Applies the configured rules (or the default rule set when none are configured).
     */
    List<Relationship> buildRelationships(Collection<Entity> entities);

    List<Relationship> buildRelationships(Collection<Entity> entities, List<RelationshipRule> rules);

    /**
     * Relationships implied by shared attributes rather than references:
     * people on the same team work with each other, and dated entities precede later ones.
     */
    List<Relationship> inferAttributeRelationships(Collection<Entity> entities);

    List<RelationshipRule> getRules();
}
