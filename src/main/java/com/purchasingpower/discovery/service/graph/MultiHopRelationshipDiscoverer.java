package com.purchasingpower.discovery.service.graph;

import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.PathAnalysis;
import com.purchasingpower.discovery.model.Relationship;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds indirect connections by walking explicit relationships.
 *
 * <p>Only entity pairs that are not already directly connected are reported, one
 * relationship per pair, carrying the full path and the product of the edge confidences.
 */
public interface MultiHopRelationshipDiscoverer {

    /**
     * @param maxHops maximum number of edges in a path; must be {@code >= 0},
     *                values below 2 yield no relationships
     */
    List<Relationship> discoverMultiHop(Collection<Entity> entities,
                                        Collection<Relationship> explicitRelationships,
                                        int maxHops);

    /**
     * Same as {@link #discoverMultiHop(Collection, Collection, int)} with the configured hop bound.
     */
    List<Relationship> discoverMultiHop(Collection<Entity> entities,
                                        Collection<Relationship> explicitRelationships);

    /**
     * Best path (shortest, then most confident) between two entities, including direct edges.
     */
    Optional<PathAnalysis> findPath(Collection<Entity> entities,
                                    Collection<Relationship> explicitRelationships,
                                    String sourceId,
                                    String targetId,
                                    int maxHops);

    PathAnalysis analyzePath(List<Entity> path, List<Double> edgeConfidences);
}
