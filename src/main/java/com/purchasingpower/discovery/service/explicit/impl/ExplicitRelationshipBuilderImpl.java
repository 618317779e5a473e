package com.purchasingpower.discovery.service.explicit.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.AttributeValue;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.RelationshipRule;
import com.purchasingpower.discovery.model.RelationshipStrength;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.model.TemporalAspect;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.explicit.ExplicitRelationshipBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExplicitRelationshipBuilderImpl implements ExplicitRelationshipBuilder {

    private static final double SAME_TEAM_CONFIDENCE = 0.8;
    private static final double PRECEDES_CONFIDENCE = 0.7;
    private static final List<String> DATE_FIELDS = List.of("created_date", "start_date");

    private final DiscoveryProperties properties;

    public static List<RelationshipRule> defaultRules() {
        return List.of(
                rule("Subscription", "customer_id", "Customer", RelationshipType.BELONGS_TO, 0.95, true),
                rule("Customer", "subscription_id", "Subscription", RelationshipType.OWNS, 0.9, false),
                rule("Team", "manager_id", "Person", RelationshipType.MANAGED_BY, 0.95, true),
                rule("Person", "team_id", "Team", RelationshipType.BELONGS_TO, 0.9, false),
                rule("Project", "team_id", "Team", RelationshipType.ASSIGNED_TO, 0.9, false),
                rule("Project", "customer_id", "Customer", RelationshipType.BELONGS_TO, 0.9, false),
                rule("Risk", "customer_id", "Customer", RelationshipType.IMPACTS, 0.9, false),
                rule("Risk", "project_id", "Project", RelationshipType.IMPACTS, 0.9, false),
                rule("Team", "objective_id", "Objective", RelationshipType.RESPONSIBLE_FOR, 0.9, false));
    }

    private static RelationshipRule rule(String sourceType, String field, String targetType,
                                         RelationshipType type, double confidence, boolean required) {
        return RelationshipRule.builder()
                .sourceType(sourceType)
                .field(field)
                .targetType(targetType)
                .relationship(type)
                .confidence(confidence)
                .required(required)
                .build();
    }

    @Override
    public List<RelationshipRule> getRules() {
        List<RelationshipRule> configured = properties.getExplicit().getRules();
        return configured == null || configured.isEmpty() ? defaultRules() : List.copyOf(configured);
    }

    @Override
    public List<Relationship> buildRelationships(Collection<Entity> entities) {
        return buildRelationships(entities, getRules());
    }

    @Override
    public List<Relationship> buildRelationships(Collection<Entity> entities, List<RelationshipRule> rules) {
        EntityIndex index = EntityIndex.of(entities);
        List<Relationship> relationships = new ArrayList<>();
        int unresolved = 0;

        for (Entity entity : index.all()) {
            for (RelationshipRule rule : rules) {
                if (!rule.matches(entity)) {
                    continue;
                }
                AttributeValue value = entity.getAttribute(rule.getField()).orElse(AttributeValue.nullValue());
                String reference = value.isNull() ? null : value.asText();
                if (reference == null || reference.isBlank()) {
                    continue;
                }

                Optional<Entity> target = index.resolve(rule.getTargetType(), reference);
                if (target.isEmpty()) {
                    unresolved++;
                    if (rule.isRequired()) {
                        log.info("Unresolved {} reference on {} {}: {}", rule.getField(), entity.getType(), entity.getId(), reference);
                    } else {
                        log.debug("Unresolved {} reference on {} {}: {}", rule.getField(), entity.getType(), entity.getId(), reference);
                    }
                    continue;
                }

                relationships.add(fromRule(entity, target.get(), rule, reference));

                if (rule.isBidirectional()) {
                    rule.getRelationship().reverse()
                            .map(reverseType -> reverseOf(entity, target.get(), rule, reverseType))
                            .ifPresent(relationships::add);
                }
            }
        }

        log.info("Built {} explicit relationships from {} entities ({} rules, {} unresolved references)",
                relationships.size(), index.size(), rules.size(), unresolved);
        return relationships;
    }

    private Relationship fromRule(Entity source, Entity target, RelationshipRule rule, String reference) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule", rule.getSourceType() + "." + rule.getField());
        metadata.put("reference", reference);

        return Relationship.builder()
                .source(source)
                .target(target)
                .relationshipType(rule.getRelationship())
                .direction(rule.isBidirectional() ? RelationshipDirection.BIDIRECTIONAL : RelationshipDirection.UNIDIRECTIONAL)
                .strength(RelationshipStrength.STRONG)
                .confidence(rule.getConfidence())
                .evidence(List.of(rule.getField() + " reference"))
                .temporalAspect(TemporalAspect.PRESENT)
                .metadata(metadata)
                .build();
    }

    private Relationship reverseOf(Entity source, Entity target, RelationshipRule rule, RelationshipType reverseType) {
        return Relationship.builder()
                .source(target)
                .target(source)
                .relationshipType(reverseType)
                .direction(RelationshipDirection.BIDIRECTIONAL)
                .strength(RelationshipStrength.STRONG)
                .confidence(rule.getConfidence())
                .evidence(List.of("Reverse of " + rule.getField() + " reference"))
                .temporalAspect(TemporalAspect.PRESENT)
                .metadata(Map.of("rule", rule.getSourceType() + "." + rule.getField(), "reverse", true))
                .build();
    }

    @Override
    public List<Relationship> inferAttributeRelationships(Collection<Entity> entities) {
        EntityIndex index = EntityIndex.of(entities);
        List<Relationship> relationships = new ArrayList<>();
        relationships.addAll(inferSameTeam(index.ofType("Person")));
        relationships.addAll(inferPrecedence(index));
        log.debug("Inferred {} relationships from shared attributes", relationships.size());
        return relationships;
    }

    private List<Relationship> inferSameTeam(List<Entity> people) {
        Map<String, List<Entity>> byTeam = new LinkedHashMap<>();
        for (Entity person : people) {
            person.getAttribute("team")
                    .filter(v -> !v.isNull())
                    .map(AttributeValue::asText)
                    .filter(team -> !team.isBlank())
                    .ifPresent(team -> byTeam.computeIfAbsent(team, t -> new ArrayList<>()).add(person));
        }

        List<Relationship> relationships = new ArrayList<>();
        byTeam.forEach((team, members) -> {
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    relationships.add(Relationship.builder()
                            .source(members.get(i))
                            .target(members.get(j))
                            .relationshipType(RelationshipType.WORKS_WITH)
                            .direction(RelationshipDirection.BIDIRECTIONAL)
                            .strength(RelationshipStrength.MODERATE)
                            .confidence(SAME_TEAM_CONFIDENCE)
                            .evidence(List.of("Both in team " + team))
                            .temporalAspect(TemporalAspect.PRESENT)
                            .build());
                }
            }
        });
        return relationships;
    }

    private List<Relationship> inferPrecedence(EntityIndex index) {
        List<Relationship> relationships = new ArrayList<>();
        // Dates are only compared within one entity type, e.g. projects by start date
        for (String type : index.types()) {
            List<Dated> dated = new ArrayList<>();
            for (Entity candidate : index.ofType(type)) {
                dateOf(candidate).ifPresent(date -> dated.add(new Dated(candidate, date)));
            }
            dated.sort(Comparator.comparing(Dated::date).thenComparing(d -> d.entity().getId()));
            for (int i = 0; i + 1 < dated.size(); i++) {
                Dated earlier = dated.get(i);
                Dated later = dated.get(i + 1);
                if (!earlier.date().isBefore(later.date())) {
                    continue;
                }
                relationships.add(Relationship.builder()
                        .source(earlier.entity())
                        .target(later.entity())
                        .relationshipType(RelationshipType.PRECEDES)
                        .direction(RelationshipDirection.UNIDIRECTIONAL)
                        .confidence(PRECEDES_CONFIDENCE)
                        .evidence(List.of(earlier.entity().getName() + " (" + earlier.date() + ") before "
                                + later.entity().getName() + " (" + later.date() + ")"))
                        .temporalAspect(TemporalAspect.PAST)
                        .build());
            }
        }
        return relationships;
    }

    private Optional<Instant> dateOf(Entity entity) {
        for (String field : DATE_FIELDS) {
            Optional<AttributeValue> value = entity.getAttribute(field).filter(v -> !v.isNull());
            if (value.isEmpty()) {
                continue;
            }
            Optional<Instant> parsed = value.get().asTimestamp().or(() -> parseDate(value.get().asText()));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<Instant> parseDate(String text) {
        try {
            return Optional.of(text.length() <= 10
                    ? LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
                    : Instant.parse(text));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable date '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    private record Dated(Entity entity, Instant date) {
    }
}
