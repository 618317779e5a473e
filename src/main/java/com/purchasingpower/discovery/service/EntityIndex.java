package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.exception.MalformedEntityException;
import com.purchasingpower.discovery.model.Entity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id lookup over one snapshot of entities.
 *
 * <p>Malformed entities are logged and skipped; the first entity wins when ids repeat.
 * Iteration order follows the input order.
 */
@Slf4j
public final class EntityIndex {

    private final Map<String, Entity> byId;
    private final Map<String, List<Entity>> byType;
    private final int skipped;

    private EntityIndex(Map<String, Entity> byId, Map<String, List<Entity>> byType, int skipped) {
        this.byId = byId;
        this.byType = byType;
        this.skipped = skipped;
    }

    public static EntityIndex of(Collection<Entity> entities) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        Map<String, List<Entity>> byType = new LinkedHashMap<>();
        int skipped = 0;

        if (entities != null) {
            for (Entity entity : entities) {
                try {
                    EntityValidator.validate(entity);
                } catch (MalformedEntityException e) {
                    log.warn("Skipping malformed entity: {}", e.getMessage());
                    skipped++;
                    continue;
                }
                if (byId.putIfAbsent(entity.getId(), entity) != null) {
                    log.debug("Duplicate entity id {}, keeping first occurrence", entity.getId());
                    continue;
                }
                byType.computeIfAbsent(entity.getType(), t -> new ArrayList<>()).add(entity);
            }
        }
        return new EntityIndex(byId, byType, skipped);
    }

    public Optional<Entity> get(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    public List<Entity> ofType(String type) {
        return Collections.unmodifiableList(byType.getOrDefault(type, List.of()));
    }

    public List<String> types() {
        return List.copyOf(byType.keySet());
    }

    public List<Entity> all() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public int skipped() {
        return skipped;
    }

    /**
     * Resolves a reference to an entity of the given type, by id first and then by the
     * id the entity carries in any source system.
     */
    public Optional<Entity> resolve(String targetType, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        Entity direct = byId.get(reference);
        if (direct != null && direct.getType().equals(targetType)) {
            return Optional.of(direct);
        }
        return ofType(targetType).stream()
                .filter(e -> e.getSourceIds().containsValue(reference))
                .findFirst();
    }
}
