package com.purchasingpower.discovery.exception;

import lombok.Getter;

@Getter
public class MalformedEntityException extends RuntimeException {

    private final String entityId;

    public MalformedEntityException(String message, String entityId) {
        super(message);
        this.entityId = entityId;
    }

}
