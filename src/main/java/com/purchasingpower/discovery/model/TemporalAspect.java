package com.purchasingpower.discovery.model;

public enum TemporalAspect {
    PAST,
    PRESENT,
    FUTURE,
    ONGOING
}
