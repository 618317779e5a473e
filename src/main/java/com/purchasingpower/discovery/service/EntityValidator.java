package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.exception.MalformedEntityException;
import com.purchasingpower.discovery.model.Entity;

/**
 * Rejects entities that cannot take part in a relationship.
 */
public final class EntityValidator {

    private EntityValidator() {
    }

    public static Entity validate(Entity entity) {
        if (entity == null) {
            throw new MalformedEntityException("Entity is null", null);
        }
        if (entity.getId() == null || entity.getId().isBlank()) {
            throw new MalformedEntityException("Entity has no id (type=" + entity.getType() + ")", entity.getId());
        }
        if (entity.getType() == null || entity.getType().isBlank()) {
            throw new MalformedEntityException("Entity " + entity.getId() + " has no type", entity.getId());
        }
        return entity;
    }
}
