package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Value;

/**
 * Occurrence of an entity inside a text. Offsets are character indices, end exclusive.
 */
@Value
@Builder
public class EntityMention {

    String entityId;
    String entityType;
    String surfaceForm;
    int startPos;
    int endPos;
    double confidence;

    public boolean overlaps(EntityMention other) {
        return startPos < other.endPos && other.startPos < endPos;
    }

    public int length() {
        return endPos - startPos;
    }
}
