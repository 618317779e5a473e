package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input for one discovery run. Only entities are mandatory.
 */
@Value
@Builder
public class DiscoveryRequest {

    @Singular
    List<Entity> entities;

    @Singular
    List<Event> events;

    @Singular
    List<Document> documents;

    /**
     * Filter for the merged output; the configured context is used when null.
     */
    RelationshipDiscoveryContext context;

    /**
     * Overrides {@code discovery.multi-hop.max-hops} when set.
     */
    Integer maxHops;

    @Builder.Default
    boolean recognizePatterns = true;
}
