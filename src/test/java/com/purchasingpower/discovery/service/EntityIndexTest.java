package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.exception.MalformedEntityException;
import com.purchasingpower.discovery.model.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entity Index Tests")
class EntityIndexTest {

    @Test
    @DisplayName("Should skip malformed entities and count them")
    void testSkipsMalformed() {
        // Given: one valid entity, one without id, one without type, one null
        List<Entity> entities = Arrays.asList(
                Entity.of("c1", "Customer", "TechCorp"),
                Entity.builder().type("Customer").build(),
                Entity.builder().id("x").build(),
                null);

        // When
        EntityIndex index = EntityIndex.of(entities);

        // Then
        assertEquals(1, index.size());
        assertEquals(3, index.skipped());
        assertTrue(index.contains("c1"));
    }

    @Test
    @DisplayName("Should keep the first entity when ids repeat")
    void testDuplicateIds() {
        EntityIndex index = EntityIndex.of(List.of(
                Entity.of("c1", "Customer", "TechCorp"),
                Entity.of("c1", "Customer", "Other")));

        assertEquals(1, index.size());
        assertEquals("TechCorp", index.get("c1").orElseThrow().getName());
    }

    @Test
    @DisplayName("Should resolve references by id, then by source-system id")
    void testResolve() {
        Entity customer = Entity.builder()
                .id("c1")
                .type("Customer")
                .sourceId("salesforce", "SF-001")
                .build();
        EntityIndex index = EntityIndex.of(List.of(customer, Entity.of("t1", "Team", "CS")));

        assertEquals("c1", index.resolve("Customer", "c1").orElseThrow().getId());
        assertEquals("c1", index.resolve("Customer", "SF-001").orElseThrow().getId());
        assertTrue(index.resolve("Customer", "t1").isEmpty(), "Type must match");
        assertTrue(index.resolve("Customer", "missing").isEmpty());
        assertTrue(index.resolve("Customer", " ").isEmpty());
    }

    @Test
    @DisplayName("Validator should reject entities without id")
    void testValidator() {
        MalformedEntityException e = assertThrows(MalformedEntityException.class,
                () -> EntityValidator.validate(Entity.builder().id(" ").type("Team").build()));
        assertEquals(" ", e.getEntityId());
    }
}
