package com.purchasingpower.discovery.exception;

import lombok.Getter;

/**
 * Raised when a discovery strategy fails as a whole, as opposed to a single bad input item.
 */
@Getter
public class DiscoveryException extends RuntimeException {

    private final String strategy;

    public DiscoveryException(String strategy, String message, Throwable cause) {
        super(message, cause);
        this.strategy = strategy;
    }

}
