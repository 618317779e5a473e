package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Value;

/**
 * Lagged correlation between the event series of two entities.
 *
 * <p>A positive {@code optimalLagDays} means entity1 leads entity2 by that many days;
 * a negative one means entity2 leads.
 */
@Value
@Builder
public class TemporalCorrelation {

    public static final double DEFAULT_MIN_CORRELATION = 0.5;
    public static final double DEFAULT_MIN_CAUSALITY = 0.5;

    Entity entity1;
    Entity entity2;
    double correlationCoefficient;
    int optimalLagDays;
    double causalityScore;
    double confidence;
    int eventsAnalyzed;
    int timeWindowDays;

    public boolean isCausal(double threshold) {
        return causalityScore >= threshold;
    }

    public boolean isSignificant(double minCorrelation, double minCausality) {
        return Math.abs(correlationCoefficient) >= minCorrelation && isCausal(minCausality);
    }

    public boolean isSignificant() {
        return isSignificant(DEFAULT_MIN_CORRELATION, DEFAULT_MIN_CAUSALITY);
    }
}
