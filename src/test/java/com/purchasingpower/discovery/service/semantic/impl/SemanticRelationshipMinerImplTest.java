package com.purchasingpower.discovery.service.semantic.impl;

import com.purchasingpower.discovery.TestEntities;
import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.Document;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.EntityMention;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.model.TemporalAspect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.discovery.TestEntities.entity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Semantic Relationship Miner Tests")
class SemanticRelationshipMinerImplTest {

    private final Entity alice = entity("alice", "Person", "Alice Johnson");
    private final Entity engineering = entity("eng", "Team", "Engineering");
    private final Entity migration = entity("migration", "Project", "Migration");
    private final Entity budgetRisk = entity("budget", "Risk", "Budget Risk");

    private DiscoveryProperties properties;
    private SemanticRelationshipMinerImpl miner;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        miner = new SemanticRelationshipMinerImpl(properties, TestEntities.DIRECT);
    }

    @Test
    @DisplayName("'Alice Johnson manages the Engineering team.' should yield one MANAGES")
    void testManagesSentence() {
        // When
        List<Relationship> relationships = miner.mineFromText(
                "Alice Johnson manages the Engineering team.", List.of(alice, engineering), null);

        // Then
        assertEquals(1, relationships.size());
        Relationship relationship = relationships.get(0);
        assertEquals(RelationshipType.MANAGES, relationship.getRelationshipType());
        assertEquals(RelationshipDirection.UNIDIRECTIONAL, relationship.getDirection());
        assertEquals("alice", relationship.getSource().getId());
        assertEquals("eng", relationship.getTarget().getId());
        assertEquals(TemporalAspect.PRESENT, relationship.getTemporalAspect());
        assertEquals(0.8, relationship.getConfidence(), 1e-9);
        assertEquals(List.of("Alice Johnson manages the Engineering team."), relationship.getEvidence());
        assertFalse(relationship.getMetadata().containsKey("document"));
    }

    @Test
    @DisplayName("Passive voice should reverse the relationship")
    void testPassiveImpact() {
        List<Relationship> relationships = miner.mineFromText(
                "The Migration project is impacted by the Budget Risk.", List.of(migration, budgetRisk), null);

        assertEquals(1, relationships.size());
        assertEquals(RelationshipType.IMPACTS, relationships.get(0).getRelationshipType());
        assertEquals("budget", relationships.get(0).getSource().getId());
        assertEquals("migration", relationships.get(0).getTarget().getId());
        assertEquals(TemporalAspect.PRESENT, relationships.get(0).getTemporalAspect());
    }

    @Test
    @DisplayName("Hedged sentences should lower confidence; past tense should be PAST")
    void testHedgeAndTense() {
        Relationship hedged = miner.mineFromText(
                "Alice Johnson probably manages the Engineering team.", List.of(alice, engineering), null).get(0);
        Relationship past = miner.mineFromText(
                "Alice Johnson managed the Engineering team.", List.of(alice, engineering), null).get(0);

        assertEquals(0.48, hedged.getConfidence(), 1e-9);
        assertEquals(TemporalAspect.PAST, past.getTemporalAspect());
    }

    @Test
    @DisplayName("A hedge outside the statement should not lower its confidence")
    void testHedgeOutsideStatement() {
        // Given: "might" belongs to the second clause, not to the MANAGES statement
        List<Relationship> relationships = miner.mineFromText(
                "Alice Johnson manages the Engineering team, and Bob might leave.", List.of(alice, engineering), null);

        // Then
        assertEquals(1, relationships.size());
        assertEquals(RelationshipType.MANAGES, relationships.get(0).getRelationshipType());
        assertEquals(0.8, relationships.get(0).getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Negated statements and mentions in different sentences yield nothing")
    void testNegationAndSentenceBoundary() {
        assertThat(miner.mineFromText("Alice Johnson no longer manages the Engineering team.",
                List.of(alice, engineering), null)).isEmpty();
        assertThat(miner.mineFromText("Alice Johnson is on leave. Engineering manages the roadmap.",
                List.of(alice, engineering), null)).isEmpty();
        assertThat(miner.mineFromText("Only Alice Johnson is mentioned here.",
                List.of(alice, engineering), null)).isEmpty();
    }

    @Test
    @DisplayName("Bidirectional phrases and document metadata")
    void testWorksWithAndDocumentMetadata() {
        Entity bob = entity("bob", "Person", "Bob Smith");

        List<Relationship> relationships = miner.mineFromText(
                "Alice Johnson works with Bob Smith on the migration plan.",
                List.of(alice, bob), Map.of("title", "Weekly notes"));

        assertEquals(1, relationships.size());
        assertEquals(RelationshipType.WORKS_WITH, relationships.get(0).getRelationshipType());
        assertEquals(RelationshipDirection.BIDIRECTIONAL, relationships.get(0).getDirection());
        assertEquals(Map.of("title", "Weekly notes"), relationships.get(0).getMetadata().get("document"));
    }

    @Test
    @DisplayName("Repeated statements should merge into one relationship with all evidence")
    void testMergesDuplicates() {
        List<Relationship> relationships = miner.mineFromText(
                "Alice Johnson manages the Engineering team. Alice Johnson leads Engineering well.",
                List.of(alice, engineering), null);

        assertEquals(1, relationships.size());
        assertEquals(2, relationships.get(0).getEvidence().size());
    }

    @Test
    @DisplayName("Text beyond the maximum length should be ignored")
    void testTruncation() {
        properties.getSemantic().setMaxTextLength(20);

        assertThat(miner.mineFromText("Alice Johnson manages the Engineering team.",
                List.of(alice, engineering), null)).isEmpty();
    }

    @Test
    @DisplayName("Should tag document results and skip failing documents")
    void testExtractFromDocuments() {
        Document first = Document.builder()
                .id("doc-1")
                .source("confluence")
                .text("Alice Johnson manages the Engineering team.")
                .build();
        Document second = Document.builder()
                .id("doc-2")
                .source("jira")
                .text("The Migration project is impacted by the Budget Risk.")
                .build();
        Document broken = Document.builder()
                .id("doc-3")
                .source("email")
                .text("Alice Johnson manages the Engineering team.")
                .metadata(null)
                .build();

        List<Relationship> relationships = miner.extractFromDocuments(
                List.of(first, second, broken), List.of(alice, engineering, migration, budgetRisk));

        assertEquals(2, relationships.size());
        assertEquals("doc-1", relationships.get(0).getMetadata().get("document_id"));
        assertEquals("confluence", relationships.get(0).getMetadata().get("document_source"));
        assertEquals("doc-2", relationships.get(1).getMetadata().get("document_id"));
    }

    @Test
    @DisplayName("Should return the text around the closest mention pair")
    void testRelationshipContext() {
        properties.getSemantic().setContextWindow(5);
        String text = "Intro. Alice Johnson manages the Engineering team. More text follows here.";
        Relationship relationship = miner.mineFromText(text, List.of(alice, engineering), null).get(0);
        List<EntityMention> mentions = miner.findEntityMentions(text, List.of(alice, engineering));

        String context = miner.getRelationshipContext(text, relationship, mentions).orElseThrow();

        assertEquals("tro. Alice Johnson manages the Engineering team", context);
    }
}
