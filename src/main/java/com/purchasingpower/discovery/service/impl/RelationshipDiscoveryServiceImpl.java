package com.purchasingpower.discovery.service.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.configuration.AsyncConfig;
import com.purchasingpower.discovery.model.DiscoveryRequest;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDiscoveryContext;
import com.purchasingpower.discovery.service.DiscoveryResult;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.RelationshipDeduplicator;
import com.purchasingpower.discovery.service.RelationshipDiscoveryService;
import com.purchasingpower.discovery.service.explicit.ExplicitRelationshipBuilder;
import com.purchasingpower.discovery.service.graph.GraphPatternRecognizer;
import com.purchasingpower.discovery.service.graph.MultiHopRelationshipDiscoverer;
import com.purchasingpower.discovery.service.semantic.SemanticRelationshipMiner;
import com.purchasingpower.discovery.service.temporal.TemporalRelationshipAnalyzer;
import com.purchasingpower.discovery.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

@Slf4j
@Service
public class RelationshipDiscoveryServiceImpl implements RelationshipDiscoveryService {

    static final String EXPLICIT = "explicit";
    static final String MULTI_HOP = "multi_hop";
    static final String TEMPORAL = "temporal";
    static final String SEMANTIC = "semantic";

    private final DiscoveryProperties properties;
    private final ExplicitRelationshipBuilder explicitBuilder;
    private final MultiHopRelationshipDiscoverer multiHopDiscoverer;
    private final TemporalRelationshipAnalyzer temporalAnalyzer;
    private final SemanticRelationshipMiner semanticMiner;
    private final GraphPatternRecognizer patternRecognizer;
    private final Executor executor;

    public RelationshipDiscoveryServiceImpl(DiscoveryProperties properties,
                                            ExplicitRelationshipBuilder explicitBuilder,
                                            MultiHopRelationshipDiscoverer multiHopDiscoverer,
                                            TemporalRelationshipAnalyzer temporalAnalyzer,
                                            SemanticRelationshipMiner semanticMiner,
                                            GraphPatternRecognizer patternRecognizer,
                                            @Qualifier(AsyncConfig.DISCOVERY_EXECUTOR) Executor executor) {
        this.properties = properties;
        this.explicitBuilder = explicitBuilder;
        this.multiHopDiscoverer = multiHopDiscoverer;
        this.temporalAnalyzer = temporalAnalyzer;
        this.semanticMiner = semanticMiner;
        this.patternRecognizer = patternRecognizer;
        this.executor = executor;
    }

    @Override
    public DiscoveryResult discover(DiscoveryRequest request) {
        long startTime = System.currentTimeMillis();
        EntityIndex index = EntityIndex.of(request.getEntities());
        List<Entity> entities = index.all();
        if (entities.isEmpty()) {
            log.info("No valid entities supplied, nothing to discover");
            DiscoveryResultImpl result = DiscoveryResultImpl.empty(System.currentTimeMillis() - startTime);
            result.setSkippedEntities(index.skipped());
            return result;
        }

        log.info("🔍 Starting relationship discovery: {} entities, {} events, {} documents",
                entities.size(), request.getEvents().size(), request.getDocuments().size());

        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        int maxHops = request.getMaxHops() != null ? request.getMaxHops() : properties.getMultiHop().getMaxHops();

        CompletableFuture<List<Relationship>> explicit = run(EXPLICIT, properties.getExplicit().isEnabled(), errors,
                () -> buildExplicit(entities));
        CompletableFuture<List<Relationship>> multiHop = explicit.thenCompose(explicitRelationships ->
                run(MULTI_HOP, properties.getMultiHop().isEnabled(), errors,
                        () -> multiHopDiscoverer.discoverMultiHop(entities, explicitRelationships, maxHops)));
        CompletableFuture<List<Relationship>> temporal = run(TEMPORAL,
                properties.getTemporal().isEnabled() && !request.getEvents().isEmpty(), errors,
                () -> temporalAnalyzer.analyzeTemporalPatterns(entities, request.getEvents()));
        // Document tasks go to the same pool, so the semantic step is composed rather than run as a task
        CompletableFuture<List<Relationship>> semantic = compose(SEMANTIC,
                properties.getSemantic().isEnabled() && !request.getDocuments().isEmpty(), errors,
                () -> semanticMiner.extractFromDocumentsAsync(request.getDocuments(), entities));

        CompletableFuture.allOf(explicit, multiHop, temporal, semantic).join();

        Map<String, Integer> counts = new LinkedHashMap<>();
        List<Relationship> all = new ArrayList<>();
        collect(EXPLICIT, explicit.join(), counts, all);
        collect(MULTI_HOP, multiHop.join(), counts, all);
        collect(TEMPORAL, temporal.join(), counts, all);
        collect(SEMANTIC, semantic.join(), counts, all);

        RelationshipDiscoveryContext context = request.getContext() != null ? request.getContext() : defaultContext();
        List<Relationship> relationships = RelationshipDeduplicator.deduplicate(all).stream()
                .filter(context::shouldIncludeRelationship)
                .toList();

        List<GraphPattern> patterns = List.of();
        if (request.isRecognizePatterns() && properties.getPatterns().isEnabled() && !relationships.isEmpty()) {
            patterns = guarded("patterns", true, errors,
                    () -> patternRecognizer.recognizePatterns(entities, relationships));
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("✅ Discovery complete in {} ms: {} relationships ({} before merge), {} patterns, by strategy {}",
                duration, relationships.size(), all.size(), patterns.size(), LogFormat.formatMap(counts));
        log.debug("Relationships by type: {}", LogFormat.countByType(relationships));

        return DiscoveryResultImpl.builder()
                .relationships(relationships)
                .patterns(patterns)
                .strategyCounts(counts)
                .skippedEntities(index.skipped())
                .durationMs(duration)
                .errors(new ArrayList<>(errors))
                .build();
    }

    private List<Relationship> buildExplicit(List<Entity> entities) {
        List<Relationship> relationships = new ArrayList<>(explicitBuilder.buildRelationships(entities));
        if (properties.getExplicit().isInferFromAttributes()) {
            relationships.addAll(explicitBuilder.inferAttributeRelationships(entities));
        }
        return relationships;
    }

    private RelationshipDiscoveryContext defaultContext() {
        DiscoveryProperties.Context config = properties.getContext();
        return RelationshipDiscoveryContext.builder()
                .minConfidence(config.getMinConfidence())
                .excludeTypes(config.getExcludeTypes() != null ? config.getExcludeTypes() : Set.of())
                .build();
    }

    private CompletableFuture<List<Relationship>> run(String strategy, boolean enabled, List<String> errors,
                                                      Supplier<List<Relationship>> work) {
        if (!enabled) {
            return CompletableFuture.completedFuture(guarded(strategy, false, errors, work));
        }
        try {
            return CompletableFuture.supplyAsync(() -> guarded(strategy, true, errors, work), executor);
        } catch (RejectedExecutionException e) {
            return failed(strategy, errors, e);
        }
    }

    private CompletableFuture<List<Relationship>> compose(String strategy, boolean enabled, List<String> errors,
                                                          Supplier<CompletableFuture<List<Relationship>>> work) {
        if (!enabled) {
            log.debug("Strategy {} disabled or has no input, skipping", strategy);
            return CompletableFuture.completedFuture(List.of());
        }
        try {
            return work.get().exceptionally(ex -> {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                log.error("❌ Strategy {} failed: {}", strategy, cause.getMessage(), cause);
                errors.add(strategy + ": " + cause.getMessage());
                return List.of();
            });
        } catch (RuntimeException e) {
            return failed(strategy, errors, e);
        }
    }

    private static CompletableFuture<List<Relationship>> failed(String strategy, List<String> errors, RuntimeException e) {
        log.error("❌ Strategy {} could not start: {}", strategy, e.getMessage(), e);
        errors.add(strategy + ": " + e.getMessage());
        return CompletableFuture.completedFuture(List.of());
    }

    /**
     * A failing strategy contributes nothing; the others still complete.
     */
    private <T> List<T> guarded(String strategy, boolean enabled, List<String> errors, Supplier<List<T>> work) {
        if (!enabled) {
            log.debug("Strategy {} disabled or has no input, skipping", strategy);
            return List.of();
        }
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("❌ Strategy {} failed: {}", strategy, e.getMessage(), e);
            errors.add(strategy + ": " + e.getMessage());
            return List.of();
        }
    }

    private static void collect(String strategy, List<Relationship> found, Map<String, Integer> counts,
                                List<Relationship> all) {
        counts.put(strategy, found.size());
        all.addAll(found);
    }
}
