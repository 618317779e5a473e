package com.purchasingpower.discovery.model;

/**
 * Whether a relationship reads the same from both ends.
 */
public enum RelationshipDirection {
    UNIDIRECTIONAL,
    BIDIRECTIONAL
}
