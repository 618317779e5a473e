package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Readable breakdown of a multi-hop path.
 */
@Value
@Builder
public class PathAnalysis {

    List<Entity> path;

    /**
     * Confidence of each edge, {@code edgeConfidences.get(i)} joins {@code path.get(i)} and {@code path.get(i + 1)}.
     */
    List<Double> edgeConfidences;

    double score;
    String interpretation;
    String actionableInsight;

    /**
     * Indices of edges weaker than 70% of the mean edge confidence.
     */
    List<Integer> bottlenecks;

    public int hops() {
        return edgeConfidences.size();
    }

    public Optional<String> getWeakestLink() {
        if (edgeConfidences.isEmpty()) {
            return Optional.empty();
        }
        int weakest = 0;
        for (int i = 1; i < edgeConfidences.size(); i++) {
            if (edgeConfidences.get(i) < edgeConfidences.get(weakest)) {
                weakest = i;
            }
        }
        return Optional.of(path.get(weakest).getName() + " -> " + path.get(weakest + 1).getName()
                + String.format(Locale.ROOT, " (%.2f)", edgeConfidences.get(weakest)));
    }
}
