package com.purchasingpower.discovery.service.graph;

import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.Relationship;

import java.util.Collection;
import java.util.List;

/**
 * Finds hubs, triangles, communities, stars and chains in the relationship graph.
 *
 * <p>The graph is treated as undirected; parallel edges collapse to the most confident one.
 * Patterns are returned most important first.
 */
public interface GraphPatternRecognizer {

    List<GraphPattern> recognizePatterns(Collection<Entity> entities, Collection<Relationship> relationships);
}
