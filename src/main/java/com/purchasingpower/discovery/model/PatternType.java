package com.purchasingpower.discovery.model;

public enum PatternType {
    HUB(0.9),
    COMMUNITY(0.8),
    TRIANGLE(0.7),
    STAR(0.7),
    CHAIN(0.6);

    private final double baseImportance;

    PatternType(double baseImportance) {
        this.baseImportance = baseImportance;
    }

    public double getBaseImportance() {
        return baseImportance;
    }
}
