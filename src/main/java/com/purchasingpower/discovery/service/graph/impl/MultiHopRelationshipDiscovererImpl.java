package com.purchasingpower.discovery.service.graph.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.PathAnalysis;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.RelationshipStrength;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.model.TemporalAspect;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.graph.MultiHopRelationshipDiscoverer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

@Slf4j
@Service
@RequiredArgsConstructor
public class MultiHopRelationshipDiscovererImpl implements MultiHopRelationshipDiscoverer {

    private static final Set<String> IMPACT_CARRIER_TYPES = Set.of("Risk", "Objective");
    private static final double BOTTLENECK_RATIO = 0.7;

    private final DiscoveryProperties properties;

    @Override
    public List<Relationship> discoverMultiHop(Collection<Entity> entities, Collection<Relationship> explicitRelationships) {
        return discoverMultiHop(entities, explicitRelationships, properties.getMultiHop().getMaxHops());
    }

    @Override
    public List<Relationship> discoverMultiHop(Collection<Entity> entities,
                                               Collection<Relationship> explicitRelationships,
                                               int maxHops) {
        checkArgument(maxHops >= 0, "maxHops must be >= 0, was %s", maxHops);
        if (maxHops < 2 || explicitRelationships == null || explicitRelationships.isEmpty()) {
            return List.of();
        }

        EntityIndex index = EntityIndex.of(entities);
        Graph graph = Graph.of(index, explicitRelationships);
        Deadline deadline = new Deadline(properties.getMultiHop().getMaxSearchMillis());
        double minConfidence = properties.getMultiHop().getMinPathConfidence();

        Map<Set<String>, PathState> bestPerPair = new LinkedHashMap<>();
        for (Entity source : index.all()) {
            if (deadline.expired()) {
                log.warn("Multi-hop search stopped after {} ms, returning {} paths found so far",
                        deadline.budgetMillis, bestPerPair.size());
                break;
            }
            Map<String, PathState> reached = search(graph, source.getId(), maxHops, deadline);
            for (PathState state : reached.values()) {
                String targetId = state.last();
                if (state.hops() < 2 || graph.directlyConnected(source.getId(), targetId)) {
                    continue;
                }
                if (state.score < minConfidence) {
                    continue;
                }
                bestPerPair.merge(Set.of(source.getId(), targetId), state,
                        (kept, candidate) -> candidate.betterThan(kept) ? candidate : kept);
            }
        }

        List<Relationship> relationships = bestPerPair.values().stream()
                .map(state -> toRelationship(index, state))
                .collect(Collectors.toList());

        log.info("🔍 Discovered {} multi-hop relationships (maxHops={}, {} entities, {} edges)",
                relationships.size(), maxHops, index.size(), explicitRelationships.size());
        return relationships;
    }

    @Override
    public Optional<PathAnalysis> findPath(Collection<Entity> entities,
                                           Collection<Relationship> explicitRelationships,
                                           String sourceId,
                                           String targetId,
                                           int maxHops) {
        checkArgument(maxHops >= 0, "maxHops must be >= 0, was %s", maxHops);
        EntityIndex index = EntityIndex.of(entities);
        if (!index.contains(sourceId) || !index.contains(targetId) || sourceId.equals(targetId)) {
            return Optional.empty();
        }
        Graph graph = Graph.of(index, explicitRelationships);
        Deadline deadline = new Deadline(properties.getMultiHop().getMaxSearchMillis());
        return Optional.ofNullable(search(graph, sourceId, maxHops, deadline).get(targetId))
                .map(state -> analyzePath(state.entities(index), state.confidences));
    }

    /**
     * Level-by-level BFS. Each node keeps the most confident path among those reaching it at
     * its shortest depth; nodes are never revisited, so paths cannot loop.
     */
    private Map<String, PathState> search(Graph graph, String sourceId, int maxHops, Deadline deadline) {
        Map<String, PathState> reached = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(sourceId);

        Map<String, PathState> frontier = new LinkedHashMap<>();
        frontier.put(sourceId, PathState.start(sourceId));

        for (int depth = 1; depth <= maxHops && !frontier.isEmpty(); depth++) {
            if (deadline.expired()) {
                break;
            }
            Map<String, PathState> next = new LinkedHashMap<>();
            for (PathState state : frontier.values()) {
                for (Edge edge : graph.edgesFrom(state.last())) {
                    if (visited.contains(edge.targetId)) {
                        continue;
                    }
                    PathState candidate = state.extend(edge);
                    next.merge(edge.targetId, candidate,
                            (kept, other) -> other.score > kept.score ? other : kept);
                }
            }
            visited.addAll(next.keySet());
            reached.putAll(next);
            frontier = next;
        }
        return reached;
    }

    private Relationship toRelationship(EntityIndex index, PathState state) {
        List<Entity> path = state.entities(index);
        PathAnalysis analysis = analyzePath(path, state.confidences);

        List<String> evidence = new ArrayList<>();
        evidence.add(String.format(Locale.ROOT, "Connected via %d intermediate hop(s): %s",
                state.hops() - 1,
                path.stream().map(Entity::getName).collect(Collectors.joining(" -> "))));
        evidence.add(analysis.getInterpretation());
        if (!analysis.getBottlenecks().isEmpty()) {
            analysis.getWeakestLink().ifPresent(link -> evidence.add("Weakest link: " + link));
        }

        Map<String, Object> pathAnalysis = new LinkedHashMap<>();
        pathAnalysis.put("interpretation", analysis.getInterpretation());
        pathAnalysis.put("actionable_insight", analysis.getActionableInsight());
        pathAnalysis.put("edge_confidences", analysis.getEdgeConfidences());
        pathAnalysis.put("edge_types", state.types.stream().map(Enum::name).toList());
        pathAnalysis.put("bottlenecks", analysis.getBottlenecks());

        return Relationship.builder()
                .source(path.get(0))
                .target(path.get(path.size() - 1))
                .relationshipType(classify(path))
                .direction(RelationshipDirection.UNIDIRECTIONAL)
                .strength(RelationshipStrength.fromConfidence(state.score))
                .confidence(state.score)
                .evidence(evidence)
                .temporalAspect(TemporalAspect.PRESENT)
                .path(path)
                .metadata(Map.of("path_analysis", pathAnalysis, "hops", state.hops()))
                .build();
    }

    private RelationshipType classify(List<Entity> path) {
        int hops = path.size() - 1;
        if (hops <= 2) {
            return RelationshipType.CONNECTED_VIA;
        }
        boolean throughImpactCarrier = path.stream()
                .anyMatch(e -> IMPACT_CARRIER_TYPES.contains(e.getType()));
        return throughImpactCarrier ? RelationshipType.INDIRECTLY_AFFECTS : RelationshipType.CONNECTED_VIA;
    }

    @Override
    public PathAnalysis analyzePath(List<Entity> path, List<Double> edgeConfidences) {
        checkArgument(path.size() == edgeConfidences.size() + 1,
                "path of %s entities needs %s edge confidences", path.size(), path.size() - 1);

        double score = edgeConfidences.stream().reduce(1.0, (a, b) -> a * b);
        double mean = edgeConfidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        List<Integer> bottlenecks = new ArrayList<>();
        for (int i = 0; i < edgeConfidences.size(); i++) {
            if (edgeConfidences.get(i) < BOTTLENECK_RATIO * mean) {
                bottlenecks.add(i);
            }
        }

        return PathAnalysis.builder()
                .path(List.copyOf(path))
                .edgeConfidences(List.copyOf(edgeConfidences))
                .score(score)
                .interpretation(interpret(path))
                .actionableInsight(insight(path))
                .bottlenecks(bottlenecks)
                .build();
    }

    private String interpret(List<Entity> path) {
        Entity source = path.get(0);
        Entity target = path.get(path.size() - 1);
        if (path.size() == 2) {
            return source.getName() + " is directly linked to " + target.getName();
        }
        String via = path.subList(1, path.size() - 1).stream()
                .map(e -> e.getName() + " (" + e.getType() + ")")
                .collect(Collectors.joining(", then "));
        return source.getName() + " (" + source.getType() + ") reaches "
                + target.getName() + " (" + target.getType() + ") through " + via;
    }

    private String insight(List<Entity> path) {
        Entity source = path.get(0);
        Entity target = path.get(path.size() - 1);
        Optional<Entity> risk = path.stream().filter(e -> "Risk".equals(e.getType())).findFirst();
        if (risk.isPresent()) {
            return "Monitor " + risk.get().getName() + ": it links " + source.getName() + " and " + target.getName();
        }
        Optional<Entity> objective = path.stream().filter(e -> "Objective".equals(e.getType())).findFirst();
        if (objective.isPresent()) {
            return "Changes to " + source.getName() + " may affect objective " + objective.get().getName();
        }
        if (path.size() > 2) {
            return "Involve " + path.get(1).getName() + " when coordinating " + source.getName() + " with " + target.getName();
        }
        return "No intermediate dependency";
    }

    private record Edge(String targetId, double confidence, RelationshipType type) {
    }

    private static final class Graph {
        private final Map<String, List<Edge>> adjacency = new LinkedHashMap<>();
        private final Set<Set<String>> directPairs = new HashSet<>();

        static Graph of(EntityIndex index, Collection<Relationship> relationships) {
            Graph graph = new Graph();
            for (Relationship relationship : relationships) {
                String sourceId = relationship.getSource().getId();
                String targetId = relationship.getTarget().getId();
                if (!index.contains(sourceId) || !index.contains(targetId) || sourceId.equals(targetId)) {
                    continue;
                }
                graph.add(sourceId, new Edge(targetId, relationship.getConfidence(), relationship.getRelationshipType()));
                if (relationship.isBidirectional()) {
                    graph.add(targetId, new Edge(sourceId, relationship.getConfidence(), relationship.getRelationshipType()));
                }
                graph.directPairs.add(Set.of(sourceId, targetId));
            }
            return graph;
        }

        private void add(String from, Edge edge) {
            adjacency.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        }

        List<Edge> edgesFrom(String nodeId) {
            return adjacency.getOrDefault(nodeId, List.of());
        }

        boolean directlyConnected(String a, String b) {
            return directPairs.contains(Set.of(a, b));
        }
    }

    private static final class PathState {
        private final List<String> nodes;
        private final List<Double> confidences;
        private final List<RelationshipType> types;
        private final double score;

        private PathState(List<String> nodes, List<Double> confidences, List<RelationshipType> types, double score) {
            this.nodes = nodes;
            this.confidences = confidences;
            this.types = types;
            this.score = score;
        }

        static PathState start(String nodeId) {
            return new PathState(List.of(nodeId), List.of(), List.of(), 1.0);
        }

        PathState extend(Edge edge) {
            List<String> nextNodes = new ArrayList<>(nodes);
            nextNodes.add(edge.targetId);
            List<Double> nextConfidences = new ArrayList<>(confidences);
            nextConfidences.add(edge.confidence);
            List<RelationshipType> nextTypes = new ArrayList<>(types);
            nextTypes.add(edge.type);
            return new PathState(nextNodes, nextConfidences, nextTypes, score * edge.confidence);
        }

        String last() {
            return nodes.get(nodes.size() - 1);
        }

        int hops() {
            return nodes.size() - 1;
        }

        boolean betterThan(PathState other) {
            if (hops() != other.hops()) {
                return hops() < other.hops();
            }
            return score > other.score;
        }

        List<Entity> entities(EntityIndex index) {
            return nodes.stream().map(id -> index.get(id).orElseThrow()).toList();
        }
    }

    private static final class Deadline {
        private final long budgetMillis;
        private final long expiresAt;

        Deadline(long budgetMillis) {
            this.budgetMillis = budgetMillis;
            this.expiresAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budgetMillis);
        }

        boolean expired() {
            return System.nanoTime() > expiresAt;
        }
    }
}
