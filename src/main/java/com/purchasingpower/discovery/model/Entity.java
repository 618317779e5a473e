package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A typed business entity (Customer, Team, Project, Risk, Person, Objective, Subscription...).
 *
 * <p>Entities are supplied by the caller and only referenced by relationships.
 */
@Value
@Builder(toBuilder = true)
public class Entity {

    String id;
    String type;

    @Singular("attribute")
    Map<String, AttributeValue> attributes;

    /**
     * Alternate surface forms used for mention detection in text.
     */
    @Singular("alias")
    List<String> aliases;

    /**
     * Identifier of this entity in each source system it was merged from.
     */
    @Singular("sourceId")
    Map<String, String> sourceIds;

    public Optional<AttributeValue> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    /**
     * Display name: the {@code name} attribute, then {@code title}, then the id.
     */
    public String getName() {
        return textAttribute("name")
                .or(() -> textAttribute("title"))
                .orElse(id);
    }

    private Optional<String> textAttribute(String key) {
        return getAttribute(key)
                .filter(v -> !v.isNull())
                .map(AttributeValue::asText)
                .filter(s -> !s.isBlank());
    }

    public static Entity of(String id, String type, String name) {
        return Entity.builder()
                .id(id)
                .type(type)
                .attribute("name", AttributeValue.of(name))
                .build();
    }
}
