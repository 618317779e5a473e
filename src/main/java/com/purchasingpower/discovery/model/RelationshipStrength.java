package com.purchasingpower.discovery.model;

public enum RelationshipStrength {
    WEAK,
    MODERATE,
    STRONG;

    public static RelationshipStrength fromConfidence(double confidence) {
        if (confidence >= 0.8) {
            return STRONG;
        }
        if (confidence >= 0.5) {
            return MODERATE;
        }
        return WEAK;
    }
}
