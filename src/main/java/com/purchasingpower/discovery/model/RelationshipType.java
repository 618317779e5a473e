package com.purchasingpower.discovery.model;

import java.util.Optional;

/**
 * Closed vocabulary of relationship labels, grouped by how they are discovered.
 */
public enum RelationshipType {

    // Explicit (foreign-key) relationships
    BELONGS_TO(Category.EXPLICIT),
    MANAGED_BY(Category.EXPLICIT),
    ASSIGNED_TO(Category.EXPLICIT),
    OWNS(Category.EXPLICIT),
    PARENT_OF(Category.EXPLICIT),
    CHILD_OF(Category.EXPLICIT),

    // Inferred from text, time series or attributes
    IMPACTS(Category.INFERRED),
    CORRELATES_WITH(Category.INFERRED),
    INFLUENCED_BY(Category.INFERRED),
    WORKS_WITH(Category.INFERRED),
    COLLABORATES_WITH(Category.INFERRED),
    RESPONSIBLE_FOR(Category.INFERRED),
    MANAGES(Category.INFERRED),
    REPORTS_TO(Category.INFERRED),
    DEPENDS_ON(Category.INFERRED),
    RELATED_TO(Category.INFERRED),
    PRECEDES(Category.INFERRED),

    // Path based
    CONNECTED_VIA(Category.MULTI_HOP),
    INDIRECTLY_AFFECTS(Category.MULTI_HOP);

    public enum Category {
        EXPLICIT,
        INFERRED,
        MULTI_HOP
    }

    private final Category category;

    RelationshipType(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Type that reads the same fact from the other end, if there is one.
     */
    public Optional<RelationshipType> reverse() {
        return Optional.ofNullable(switch (this) {
            case OWNS -> BELONGS_TO;
            case BELONGS_TO -> OWNS;
            case MANAGES -> MANAGED_BY;
            case MANAGED_BY, REPORTS_TO -> MANAGES;
            case PARENT_OF -> CHILD_OF;
            case CHILD_OF -> PARENT_OF;
            default -> null;
        });
    }
}
