package com.purchasingpower.discovery.service.graph.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.CollaborationPattern;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.PatternType;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.graph.GraphPatternRecognizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphPatternRecognizerImpl implements GraphPatternRecognizer {

    private static final double STAR_LEAF_RATIO = 0.7;

    private final DiscoveryProperties properties;

    @Override
    public List<GraphPattern> recognizePatterns(Collection<Entity> entities, Collection<Relationship> relationships) {
        UndirectedGraph graph = UndirectedGraph.of(entities, relationships);
        if (graph.nodeCount() == 0) {
            return List.of();
        }

        List<GraphPattern> patterns = new ArrayList<>();
        patterns.addAll(findHubs(graph));
        patterns.addAll(findTriangles(graph));
        patterns.addAll(findCommunities(graph));
        patterns.addAll(findStars(graph));
        patterns.addAll(findChains(graph));
        patterns.sort(Comparator.comparingDouble(GraphPattern::getImportanceScore).reversed());

        log.info("🔍 Recognized {} patterns in graph of {} entities / {} edges",
                patterns.size(), graph.nodeCount(), graph.edgeCount());
        return patterns;
    }

    List<GraphPattern> findHubs(UndirectedGraph graph) {
        DiscoveryProperties.Patterns config = properties.getPatterns();
        double percentileCut = graph.centralityPercentile(config.getHubPercentile());

        List<GraphPattern> hubs = new ArrayList<>();
        for (String nodeId : graph.nodeIds()) {
            int degree = graph.degree(nodeId);
            double centrality = graph.centrality(nodeId);
            if (degree < config.getHubMinConnections()) {
                continue;
            }
            if (centrality < config.getHubCentralityThreshold() && centrality < percentileCut) {
                continue;
            }

            List<String> members = new ArrayList<>();
            members.add(nodeId);
            members.addAll(graph.neighbours(nodeId));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("degree", degree);
            metadata.put("hub_entity", nodeId);
            metadata.put("entity_types", graph.typeCounts(members));
            hubs.add(build(PatternType.HUB, graph, members, globalCentrality(graph, members), metadata));
        }
        return hubs;
    }

    List<GraphPattern> findTriangles(UndirectedGraph graph) {
        DiscoveryProperties.Patterns config = properties.getPatterns();
        List<GraphPattern> triangles = new ArrayList<>();
        List<String> nodes = graph.nodeIds();

        outer:
        for (int i = 0; i < nodes.size(); i++) {
            String a = nodes.get(i);
            for (int j = i + 1; j < nodes.size(); j++) {
                String b = nodes.get(j);
                if (!graph.connected(a, b)) {
                    continue;
                }
                for (int k = j + 1; k < nodes.size(); k++) {
                    String c = nodes.get(k);
                    if (!graph.connected(a, c) || !graph.connected(b, c)) {
                        continue;
                    }
                    List<String> members = List.of(a, b, c);
                    if (graph.meanWeight(members) < config.getMinTriangleStrength()) {
                        continue;
                    }
                    if (triangles.size() >= config.getMaxTriangles()) {
                        log.debug("Triangle limit {} reached", config.getMaxTriangles());
                        break outer;
                    }
                    triangles.add(triangle(graph, members));
                }
            }
        }
        return triangles;
    }

    private CollaborationPattern triangle(UndirectedGraph graph, List<String> members) {
        double strength = graph.collaborationStrength(members);
        List<String> evidence = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                String u = members.get(i);
                String v = members.get(j);
                evidence.add(String.format(Locale.ROOT, "%s -[%s]- %s (%.2f)",
                        graph.name(u), graph.bestType(u, v), graph.name(v), graph.weight(u, v)));
            }
        }
        String type = collaborationType(graph, members);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("triangle_type", type);
        metadata.put("density", 1.0);
        metadata.put("average_weight", graph.meanWeight(members));
        metadata.put("entity_types", graph.typeCounts(members));

        return CollaborationPattern.collaborationBuilder()
                .patternType(PatternType.TRIANGLE)
                .entities(graph.entities(members))
                .centralityScores(globalCentrality(graph, members))
                .metadata(metadata)
                .importanceScore(importance(PatternType.TRIANGLE, graph, members, 1.0, strength))
                .collaborationStrength(strength)
                .supportingEvidence(evidence)
                .collaborationType(type)
                .build();
    }

    private static String collaborationType(UndirectedGraph graph, List<String> members) {
        Set<String> types = graph.typeCounts(members).keySet();
        if (types.size() == 1 && types.contains("Person")) {
            return "team_collaboration";
        }
        if (types.contains("Customer")) {
            return "customer_engagement";
        }
        if (types.contains("Team") && types.contains("Project")) {
            return "project_collaboration";
        }
        return "cross_functional";
    }

    List<GraphPattern> findCommunities(UndirectedGraph graph) {
        int minSize = properties.getPatterns().getMinCommunitySize();
        List<GraphPattern> communities = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (String start : graph.nodeIds()) {
            if (!seen.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                component.add(node);
                for (String neighbour : graph.neighbours(node)) {
                    if (seen.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            if (component.size() < minSize) {
                continue;
            }

            Map<String, Double> centrality = new LinkedHashMap<>();
            Set<String> inComponent = new HashSet<>(component);
            for (String node : component) {
                long internal = graph.neighbours(node).stream().filter(inComponent::contains).count();
                centrality.put(node, (double) internal / (component.size() - 1));
            }

            double density = graph.density(component);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("size", component.size());
            metadata.put("density", density);
            metadata.put("cohesion", graph.meanWeight(component));
            metadata.put("entity_types", graph.typeCounts(component));
            communities.add(GraphPattern.builder()
                    .patternType(PatternType.COMMUNITY)
                    .entities(graph.entities(component))
                    .centralityScores(centrality)
                    .metadata(metadata)
                    .importanceScore(importance(PatternType.COMMUNITY, centrality, density, graph.meanWeight(component)))
                    .build());
        }
        return communities;
    }

    List<GraphPattern> findStars(UndirectedGraph graph) {
        int minSpokes = properties.getPatterns().getMinSpokes();
        List<GraphPattern> stars = new ArrayList<>();
        for (String centre : graph.nodeIds()) {
            List<String> spokes = graph.neighbours(centre);
            if (spokes.size() < minSpokes) {
                continue;
            }
            long leaves = spokes.stream().filter(s -> graph.degree(s) == 1).count();
            if (leaves < STAR_LEAF_RATIO * spokes.size()) {
                continue;
            }
            List<String> members = new ArrayList<>();
            members.add(centre);
            members.addAll(spokes);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("center", centre);
            metadata.put("spokes", spokes.size());
            metadata.put("leaf_ratio", (double) leaves / spokes.size());
            stars.add(build(PatternType.STAR, graph, members, globalCentrality(graph, members), metadata));
        }
        return stars;
    }

    /**
     * Simple paths made of nodes with at most two neighbours. Cycles are not chains.
     */
    List<GraphPattern> findChains(UndirectedGraph graph) {
        DiscoveryProperties.Patterns config = properties.getPatterns();
        Set<String> candidates = new LinkedHashSet<>();
        for (String node : graph.nodeIds()) {
            int degree = graph.degree(node);
            if (degree >= 1 && degree <= 2) {
                candidates.add(node);
            }
        }

        List<GraphPattern> chains = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (String node : candidates) {
            if (used.contains(node) || chainNeighbours(graph, node, candidates).size() > 1) {
                continue;
            }
            // node is an end of a chain: walk to the other end
            List<String> chain = new ArrayList<>();
            String previous = null;
            String current = node;
            while (current != null && used.add(current)) {
                chain.add(current);
                String next = null;
                for (String neighbour : chainNeighbours(graph, current, candidates)) {
                    if (!neighbour.equals(previous)) {
                        next = neighbour;
                    }
                }
                previous = current;
                current = next;
            }
            if (chain.size() < config.getMinChainLength() || chain.size() > config.getMaxChainLength()) {
                continue;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("length", chain.size());
            metadata.put("start", chain.get(0));
            metadata.put("end", chain.get(chain.size() - 1));
            chains.add(build(PatternType.CHAIN, graph, chain, globalCentrality(graph, chain), metadata));
        }
        return chains;
    }

    private static List<String> chainNeighbours(UndirectedGraph graph, String node, Set<String> candidates) {
        return graph.neighbours(node).stream().filter(candidates::contains).toList();
    }

    private GraphPattern build(PatternType type, UndirectedGraph graph, List<String> members,
                               Map<String, Double> centrality, Map<String, Object> metadata) {
        double density = graph.density(members);
        double strength = graph.meanWeight(members);
        Map<String, Object> withDensity = new LinkedHashMap<>(metadata);
        withDensity.putIfAbsent("density", density);
        return GraphPattern.builder()
                .patternType(type)
                .entities(graph.entities(members))
                .centralityScores(centrality)
                .metadata(withDensity)
                .importanceScore(importance(type, centrality, density, strength))
                .build();
    }

    private static Map<String, Double> globalCentrality(UndirectedGraph graph, List<String> members) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String member : members) {
            scores.put(member, graph.centrality(member));
        }
        return scores;
    }

    private static double importance(PatternType type, UndirectedGraph graph, List<String> members,
                                     double density, double strength) {
        return importance(type, globalCentrality(graph, members), density, strength);
    }

    /**
     * Half the type's base importance, half a blend of centrality, density and tie strength.
     */
    static double importance(PatternType type, Map<String, Double> centrality, double density, double strength) {
        double meanCentrality = centrality.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double structural = 0.4 * meanCentrality + 0.3 * density + 0.3 * strength;
        return 0.5 * type.getBaseImportance() + 0.5 * structural;
    }

    /**
     * Undirected, weighted view of one relationship set. Node order follows the entity input
     * order, then relationship endpoints that were not supplied as entities.
     */
    static final class UndirectedGraph {

        private static final Map<RelationshipType, Double> COLLABORATION_WEIGHTS = Map.of(
                RelationshipType.COLLABORATES_WITH, 1.0,
                RelationshipType.WORKS_WITH, 0.9,
                RelationshipType.ASSIGNED_TO, 0.7,
                RelationshipType.BELONGS_TO, 0.6);
        private static final double DEFAULT_COLLABORATION_WEIGHT = 0.5;

        private final EntityIndex index;
        private final Map<String, Map<String, Double>> adjacency = new LinkedHashMap<>();
        private final Map<Set<String>, RelationshipType> bestTypes = new LinkedHashMap<>();
        private int edgeCount;

        private UndirectedGraph(EntityIndex index) {
            this.index = index;
            for (Entity entity : index.all()) {
                adjacency.put(entity.getId(), new LinkedHashMap<>());
            }
        }

        static UndirectedGraph of(Collection<Entity> entities, Collection<Relationship> relationships) {
            List<Entity> nodes = new ArrayList<>(entities == null ? List.of() : entities);
            for (Relationship relationship : relationships) {
                nodes.add(relationship.getSource());
                nodes.add(relationship.getTarget());
            }
            UndirectedGraph graph = new UndirectedGraph(EntityIndex.of(nodes));
            relationships.forEach(graph::add);
            return graph;
        }

        private void add(Relationship relationship) {
            String a = relationship.getSource().getId();
            String b = relationship.getTarget().getId();
            if (a.equals(b) || !adjacency.containsKey(a) || !adjacency.containsKey(b)) {
                return;
            }
            double weight = relationship.getConfidence();
            Double existing = adjacency.get(a).get(b);
            if (existing == null) {
                edgeCount++;
            }
            if (existing == null || weight > existing) {
                adjacency.get(a).put(b, weight);
                adjacency.get(b).put(a, weight);
                bestTypes.put(Set.of(a, b), relationship.getRelationshipType());
            }
        }

        List<String> nodeIds() {
            return new ArrayList<>(adjacency.keySet());
        }

        int nodeCount() {
            return adjacency.size();
        }

        int edgeCount() {
            return edgeCount;
        }

        List<String> neighbours(String node) {
            return new ArrayList<>(adjacency.getOrDefault(node, Map.of()).keySet());
        }

        int degree(String node) {
            return adjacency.getOrDefault(node, Map.of()).size();
        }

        boolean connected(String a, String b) {
            return adjacency.getOrDefault(a, Map.of()).containsKey(b);
        }

        double weight(String a, String b) {
            return adjacency.getOrDefault(a, Map.of()).getOrDefault(b, 0.0);
        }

        RelationshipType bestType(String a, String b) {
            return bestTypes.get(Set.of(a, b));
        }

        double centrality(String node) {
            int n = nodeCount();
            return n <= 1 ? 0.0 : (double) degree(node) / (n - 1);
        }

        /**
         * Nearest-rank percentile of all node centralities.
         */
        double centralityPercentile(double percentile) {
            List<Double> values = adjacency.keySet().stream().map(this::centrality).sorted().toList();
            int rank = (int) Math.ceil(percentile * values.size());
            return values.get(Math.max(0, Math.min(values.size() - 1, rank - 1)));
        }

        double density(List<String> members) {
            int size = members.size();
            if (size < 2) {
                return 0.0;
            }
            return (double) internalEdges(members).size() / (size * (size - 1) / 2.0);
        }

        double meanWeight(List<String> members) {
            return internalEdges(members).stream().mapToDouble(e -> weight(e[0], e[1])).average().orElse(0.0);
        }

        /**
         * Type-weighted tie strength over every possible pair of members.
         */
        double collaborationStrength(List<String> members) {
            int size = members.size();
            if (size < 2) {
                return 0.0;
            }
            double total = 0.0;
            for (String[] edge : internalEdges(members)) {
                double typeWeight = COLLABORATION_WEIGHTS.getOrDefault(bestType(edge[0], edge[1]), DEFAULT_COLLABORATION_WEIGHT);
                total += typeWeight * weight(edge[0], edge[1]);
            }
            return Math.min(1.0, total / (size * (size - 1) / 2.0));
        }

        private List<String[]> internalEdges(List<String> members) {
            List<String[]> edges = new ArrayList<>();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    if (connected(members.get(i), members.get(j))) {
                        edges.add(new String[]{members.get(i), members.get(j)});
                    }
                }
            }
            return edges;
        }

        Map<String, Integer> typeCounts(List<String> members) {
            Map<String, Integer> counts = new TreeMap<>();
            for (String member : members) {
                index.get(member).ifPresent(e -> counts.merge(e.getType(), 1, Integer::sum));
            }
            return counts;
        }

        String name(String id) {
            return index.get(id).map(Entity::getName).orElse(id);
        }

        List<Entity> entities(List<String> ids) {
            return ids.stream().map(id -> index.get(id).orElseThrow()).toList();
        }
    }
}
