package com.purchasingpower.discovery.service.impl;

import com.purchasingpower.discovery.TestEntities;
import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.configuration.AsyncConfig;
import com.purchasingpower.discovery.model.DiscoveryRequest;
import com.purchasingpower.discovery.model.Document;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Event;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDiscoveryContext;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.model.TemporalCluster;
import com.purchasingpower.discovery.model.TemporalCorrelation;
import com.purchasingpower.discovery.service.DiscoveryResult;
import com.purchasingpower.discovery.service.explicit.impl.ExplicitRelationshipBuilderImpl;
import com.purchasingpower.discovery.service.graph.impl.GraphPatternRecognizerImpl;
import com.purchasingpower.discovery.service.graph.impl.MultiHopRelationshipDiscovererImpl;
import com.purchasingpower.discovery.service.semantic.impl.SemanticRelationshipMinerImpl;
import com.purchasingpower.discovery.service.temporal.TemporalRelationshipAnalyzer;
import com.purchasingpower.discovery.service.temporal.impl.TemporalRelationshipAnalyzerImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.purchasingpower.discovery.TestEntities.entity;
import static com.purchasingpower.discovery.TestEntities.withReference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Relationship Discovery Service Tests")
class RelationshipDiscoveryServiceImplTest {

    private DiscoveryProperties properties;

    private final Entity techCorp = entity("techcorp", "Customer", "TechCorp");
    private final Entity subscription = withReference(entity("sub-1", "Subscription", "Enterprise"), "customer_id", "techcorp");
    private final Entity migration = withReference(
            withReference(entity("migration", "Project", "Migration"), "team_id", "cs"), "customer_id", "techcorp");
    private final Entity cs = entity("cs", "Team", "CS");
    private final Entity risk = withReference(entity("risk-1", "Risk", "Budget Risk"), "project_id", "migration");

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
    }

    private RelationshipDiscoveryServiceImpl service(TemporalRelationshipAnalyzer temporalAnalyzer, Executor executor) {
        return new RelationshipDiscoveryServiceImpl(
                properties,
                new ExplicitRelationshipBuilderImpl(properties),
                new MultiHopRelationshipDiscovererImpl(properties),
                temporalAnalyzer,
                new SemanticRelationshipMinerImpl(properties, executor),
                new GraphPatternRecognizerImpl(properties),
                executor);
    }

    private RelationshipDiscoveryServiceImpl service(TemporalRelationshipAnalyzer temporalAnalyzer) {
        return service(temporalAnalyzer, TestEntities.DIRECT);
    }

    private RelationshipDiscoveryServiceImpl service() {
        return service(new TemporalRelationshipAnalyzerImpl(properties));
    }

    private DiscoveryRequest.DiscoveryRequestBuilder scenario() {
        return DiscoveryRequest.builder()
                .entity(techCorp)
                .entity(subscription)
                .entity(migration)
                .entity(cs)
                .entity(risk)
                .document(Document.builder()
                        .id("notes-1")
                        .source("confluence")
                        .text("TechCorp partners with CS on onboarding.")
                        .build());
    }

    @Test
    @DisplayName("Should merge explicit, multi-hop and semantic relationships")
    void testDiscover_MergesStrategies() {
        // When
        DiscoveryResult result = service().discover(scenario().build());

        // Then: 4 explicit edges, risk reaches techcorp and cs through the project, one text statement
        assertEquals(4, result.getStrategyCounts().get("explicit"));
        assertEquals(2, result.getStrategyCounts().get("multi_hop"));
        assertEquals(0, result.getStrategyCounts().get("temporal"));
        assertEquals(1, result.getStrategyCounts().get("semantic"));
        assertEquals(7, result.getRelationships().size());
        assertThat(result.getErrors()).isEmpty();

        List<Relationship> fromRisk = result.relationshipsFor("risk-1", RelationshipType.CONNECTED_VIA, true, false);
        assertThat(fromRisk).extracting(r -> r.getTarget().getId()).containsExactlyInAnyOrder("techcorp", "cs");

        List<Relationship> semantic = result.relationshipsFor("techcorp", RelationshipType.COLLABORATES_WITH, true, true);
        assertEquals(1, semantic.size());
        assertEquals("notes-1", semantic.get(0).getMetadata().get("document_id"));
        assertThat(result.getPatterns()).isNotEmpty();
    }

    @Test
    @DisplayName("Should apply the request context to the merged output")
    void testDiscover_ContextFilter() {
        DiscoveryRequest request = scenario()
                .context(RelationshipDiscoveryContext.builder()
                        .minConfidence(0.85)
                        .excludeType(RelationshipType.IMPACTS)
                        .build())
                .recognizePatterns(false)
                .build();

        DiscoveryResult result = service().discover(request);

        assertThat(result.getRelationships())
                .allMatch(r -> r.getConfidence() >= 0.85)
                .noneMatch(r -> r.getRelationshipType() == RelationshipType.IMPACTS);
        assertEquals(3, result.getRelationships().size());
        assertThat(result.getPatterns()).isEmpty();
    }

    @Test
    @DisplayName("maxHops override of 0 should disable multi-hop discovery")
    void testDiscover_MaxHopsOverride() {
        DiscoveryResult result = service().discover(scenario().maxHops(0).build());

        assertEquals(0, result.getStrategyCounts().get("multi_hop"));
    }

    @Test
    @DisplayName("A failing strategy should be reported without losing the others")
    void testDiscover_StrategyFailureIsolated() {
        TemporalRelationshipAnalyzer failing = new TemporalRelationshipAnalyzer() {
            @Override
            public List<Relationship> analyzeTemporalPatterns(Collection<Entity> entities, Collection<Event> events) {
                throw new IllegalStateException("time series store unavailable");
            }

            @Override
            public List<TemporalCorrelation> computeCorrelations(Collection<Entity> entities, Collection<Event> events) {
                return List.of();
            }

            @Override
            public List<TemporalCluster> detectTemporalClusters(Collection<Event> events, int windowDays) {
                return List.of();
            }

            @Override
            public List<TemporalCluster> detectTemporalClusters(Collection<Event> events) {
                return List.of();
            }
        };
        DiscoveryRequest request = scenario()
                .event(Event.of("techcorp", "login", Instant.parse("2024-01-01T00:00:00Z"), 1.0))
                .build();

        DiscoveryResult result = service(failing).discover(request);

        assertEquals(0, result.getStrategyCounts().get("temporal"));
        assertEquals(4, result.getStrategyCounts().get("explicit"));
        assertThat(result.getErrors()).singleElement().asString().startsWith("temporal");
    }

    @Test
    @DisplayName("Malformed entities should be skipped and counted")
    void testDiscover_SkipsMalformedEntities() {
        DiscoveryRequest request = scenario()
                .entity(Entity.builder().type("Customer").build())
                .build();

        DiscoveryResult result = service().discover(request);

        assertEquals(1, result.getSkippedEntities());
        assertEquals(4, result.getStrategyCounts().get("explicit"));
    }

    @Test
    @DisplayName("No entities should produce an empty result")
    void testDiscover_NoEntities() {
        DiscoveryResult result = service().discover(DiscoveryRequest.builder().build());

        assertThat(result.getRelationships()).isEmpty();
        assertThat(result.getStrategyCounts()).isEmpty();
    }

    private DiscoveryRequest teamNotes() {
        Entity alice = entity("alice", "Person", "Alice Johnson");
        Entity bob = entity("bob", "Person", "Bob Smith");
        Entity engineering = entity("eng", "Team", "Engineering");
        return DiscoveryRequest.builder()
                .entity(alice)
                .entity(bob)
                .entity(engineering)
                .document(Document.builder().id("doc-1").text("Alice Johnson manages the Engineering team.").build())
                .document(Document.builder().id("doc-2").text("Bob Smith works with Alice Johnson.").build())
                .build();
    }

    @Test
    @DisplayName("Concurrent runs with documents should all finish on the default discovery pool")
    void testDiscover_ConcurrentCallersShareThePool() throws Exception {
        // Given: the production pool settings shared by the strategies and the document tasks
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) new AsyncConfig().discoveryExecutor(properties);
        RelationshipDiscoveryServiceImpl service = service(new TemporalRelationshipAnalyzerImpl(properties), pool);
        int callers = 8;
        ExecutorService callerThreads = Executors.newFixedThreadPool(callers);

        try {
            // When
            List<Future<DiscoveryResult>> runs = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                runs.add(callerThreads.submit(() -> service.discover(teamNotes())));
            }

            // Then
            for (Future<DiscoveryResult> run : runs) {
                DiscoveryResult result = run.get(15, TimeUnit.SECONDS);
                assertThat(result.getErrors()).isEmpty();
                assertEquals(2, result.getStrategyCounts().get("semantic"));
                assertEquals(1, result.relationshipsFor("alice", RelationshipType.MANAGES, true, false).size());
            }
        } finally {
            callerThreads.shutdownNow();
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("A saturated pool should be reported as strategy errors, not thrown")
    void testDiscover_RejectedTasks() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("discovery pool saturated");
        };

        DiscoveryResult result = service(new TemporalRelationshipAnalyzerImpl(properties), saturated)
                .discover(teamNotes());

        assertThat(result.getRelationships()).isEmpty();
        assertThat(result.getErrors())
                .anyMatch(error -> error.startsWith("explicit"))
                .anyMatch(error -> error.startsWith("multi_hop"));
        // Rejected documents are skipped like any other failing document
        assertEquals(0, result.getStrategyCounts().get("semantic"));
    }
}
