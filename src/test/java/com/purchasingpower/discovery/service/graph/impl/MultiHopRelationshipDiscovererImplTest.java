package com.purchasingpower.discovery.service.graph.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.PathAnalysis;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipRule;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.service.explicit.impl.ExplicitRelationshipBuilderImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.purchasingpower.discovery.TestEntities.bidirectionalEdge;
import static com.purchasingpower.discovery.TestEntities.edge;
import static com.purchasingpower.discovery.TestEntities.entity;
import static com.purchasingpower.discovery.TestEntities.withReference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Multi-Hop Relationship Discoverer Tests")
class MultiHopRelationshipDiscovererImplTest {

    private DiscoveryProperties properties;
    private MultiHopRelationshipDiscovererImpl discoverer;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        discoverer = new MultiHopRelationshipDiscovererImpl(properties);
    }

    @Test
    @DisplayName("TechCorp should connect to CS through the Migration project")
    void testCustomerProjectTeamScenario() {
        // Given: Customer -OWNS-> Project -ASSIGNED_TO-> Team, both at 0.9
        Entity techCorp = withReference(entity("techcorp", "Customer", "TechCorp"), "project_id", "migration");
        Entity migration = withReference(entity("migration", "Project", "Migration"), "team_id", "cs");
        Entity cs = entity("cs", "Team", "CS");
        List<Entity> entities = List.of(techCorp, migration, cs);

        List<RelationshipRule> rules = List.of(
                RelationshipRule.of("Customer", "project_id", "Project", RelationshipType.OWNS, 0.9),
                RelationshipRule.of("Project", "team_id", "Team", RelationshipType.ASSIGNED_TO, 0.9));
        List<Relationship> explicit = new ExplicitRelationshipBuilderImpl(properties).buildRelationships(entities, rules);

        // When
        List<Relationship> multiHop = discoverer.discoverMultiHop(entities, explicit, 3);

        // Then
        assertEquals(1, multiHop.size());
        Relationship relationship = multiHop.get(0);
        assertEquals(RelationshipType.CONNECTED_VIA, relationship.getRelationshipType());
        assertEquals("techcorp", relationship.getSource().getId());
        assertEquals("cs", relationship.getTarget().getId());
        assertEquals(3, relationship.getPathLength());
        assertEquals(0.81, relationship.getConfidence(), 1e-9);
        assertEquals(List.of("techcorp", "migration", "cs"),
                relationship.getPath().stream().map(Entity::getId).collect(Collectors.toList()));
        assertThat(relationship.getEvidence().get(0)).startsWith("Connected via 1 intermediate hop(s)");
    }

    @Test
    @DisplayName("maxHops of 0 or 1 should discover nothing; negative maxHops is rejected")
    void testHopBounds() {
        Entity a = entity("a", "Team", "A");
        Entity b = entity("b", "Team", "B");
        Entity c = entity("c", "Team", "C");
        List<Relationship> explicit = List.of(
                edge(a, b, RelationshipType.WORKS_WITH, 0.9),
                edge(b, c, RelationshipType.WORKS_WITH, 0.9));

        assertThat(discoverer.discoverMultiHop(List.of(a, b, c), explicit, 0)).isEmpty();
        assertThat(discoverer.discoverMultiHop(List.of(a, b, c), explicit, 1)).isEmpty();
        assertThrows(IllegalArgumentException.class,
                () -> discoverer.discoverMultiHop(List.of(a, b, c), explicit, -1));
    }

    @Test
    @DisplayName("Longer paths through a Risk should be INDIRECTLY_AFFECTS")
    void testIndirectlyAffectsThroughRisk() {
        // Given: Team -> Project -> Risk -> Customer
        Entity team = entity("t", "Team", "Platform");
        Entity project = entity("p", "Project", "Migration");
        Entity risk = entity("r", "Risk", "Data loss");
        Entity customer = entity("c", "Customer", "TechCorp");
        List<Relationship> explicit = List.of(
                edge(team, project, RelationshipType.ASSIGNED_TO, 0.9),
                edge(project, risk, RelationshipType.IMPACTS, 0.9),
                edge(risk, customer, RelationshipType.IMPACTS, 0.9));

        // When
        List<Relationship> multiHop = discoverer.discoverMultiHop(List.of(team, project, risk, customer), explicit, 3);

        // Then
        Map<String, Relationship> byPair = multiHop.stream()
                .collect(Collectors.toMap(r -> r.getSource().getId() + "->" + r.getTarget().getId(), r -> r));
        assertEquals(3, multiHop.size());
        assertEquals(RelationshipType.CONNECTED_VIA, byPair.get("t->r").getRelationshipType());
        assertEquals(RelationshipType.CONNECTED_VIA, byPair.get("p->c").getRelationshipType());
        Relationship longest = byPair.get("t->c");
        assertEquals(RelationshipType.INDIRECTLY_AFFECTS, longest.getRelationshipType());
        assertEquals(4, longest.getPathLength());
        assertEquals(0.729, longest.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Path endpoints should match and confidence should not exceed the weakest edge")
    void testPathInvariants() {
        Entity a = entity("a", "Person", "A");
        Entity b = entity("b", "Team", "B");
        Entity c = entity("c", "Project", "C");
        Entity d = entity("d", "Customer", "D");
        List<Relationship> explicit = List.of(
                bidirectionalEdge(a, b, RelationshipType.WORKS_WITH, 0.95),
                edge(b, c, RelationshipType.RESPONSIBLE_FOR, 0.7),
                edge(c, d, RelationshipType.BELONGS_TO, 0.85));

        List<Relationship> multiHop = discoverer.discoverMultiHop(List.of(a, b, c, d), explicit, 3);

        assertThat(multiHop).isNotEmpty();
        for (Relationship relationship : multiHop) {
            List<Entity> path = relationship.getPath();
            assertEquals(relationship.getSource().getId(), path.get(0).getId());
            assertEquals(relationship.getTarget().getId(), path.get(path.size() - 1).getId());
            assertTrue(relationship.getConfidence() <= 0.7 + 1e-9);
            assertEquals(path.size(), path.stream().map(Entity::getId).distinct().count(), "No node revisited");
        }
    }

    @Test
    @DisplayName("Should keep one relationship per pair, preferring the shorter path")
    void testShorterPathPreferred() {
        properties.getMultiHop().setMinPathConfidence(0.0);
        Entity a = entity("a", "Team", "A");
        Entity b = entity("b", "Team", "B");
        Entity c = entity("c", "Team", "C");
        Entity d = entity("d", "Team", "D");
        Entity e = entity("e", "Team", "E");
        List<Relationship> explicit = List.of(
                bidirectionalEdge(a, b, RelationshipType.WORKS_WITH, 0.5),
                bidirectionalEdge(b, c, RelationshipType.WORKS_WITH, 0.5),
                bidirectionalEdge(a, d, RelationshipType.WORKS_WITH, 0.99),
                bidirectionalEdge(d, e, RelationshipType.WORKS_WITH, 0.99),
                bidirectionalEdge(e, c, RelationshipType.WORKS_WITH, 0.99));

        List<Relationship> multiHop = discoverer.discoverMultiHop(List.of(a, b, c, d, e), explicit, 3);

        List<Relationship> acPair = multiHop.stream()
                .filter(r -> r.involves("a") && r.involves("c"))
                .toList();
        assertEquals(1, acPair.size());
        assertEquals(3, acPair.get(0).getPathLength());
        assertEquals(0.25, acPair.get(0).getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should drop paths below the minimum path confidence")
    void testMinPathConfidence() {
        Entity a = entity("a", "Team", "A");
        Entity b = entity("b", "Team", "B");
        Entity c = entity("c", "Team", "C");
        List<Relationship> explicit = List.of(
                edge(a, b, RelationshipType.WORKS_WITH, 0.5),
                edge(b, c, RelationshipType.WORKS_WITH, 0.5));

        assertThat(discoverer.discoverMultiHop(List.of(a, b, c), explicit, 3)).isEmpty();
    }

    @Test
    @DisplayName("Should analyze the best path between two entities and flag bottlenecks")
    void testFindPath() {
        Entity a = entity("a", "Customer", "TechCorp");
        Entity b = entity("b", "Project", "Migration");
        Entity c = entity("c", "Risk", "Data loss");
        List<Relationship> explicit = List.of(
                edge(a, b, RelationshipType.OWNS, 0.9),
                edge(b, c, RelationshipType.IMPACTS, 0.3));

        PathAnalysis analysis = discoverer.findPath(List.of(a, b, c), explicit, "a", "c", 3).orElseThrow();

        assertEquals(2, analysis.hops());
        assertEquals(0.27, analysis.getScore(), 1e-9);
        assertEquals(List.of(1), analysis.getBottlenecks());
        assertThat(analysis.getWeakestLink()).contains("Migration -> Data loss (0.30)");
        assertThat(analysis.getActionableInsight()).contains("Data loss");
        assertTrue(discoverer.findPath(List.of(a, b, c), explicit, "c", "a", 3).isEmpty());
    }
}
