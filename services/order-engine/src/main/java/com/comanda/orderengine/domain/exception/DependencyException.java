package com.comanda.orderengine.domain.exception;

/**
 * An external collaborator (catalog, inventory, promotions) failed. Price-sensitive operations
 * never fall back to cached data; the whole command fails and may be retried.
 */
public class DependencyException extends OrderEngineException {

    private final String collaborator;

    public DependencyException(String collaborator, String message, Throwable cause) {
        super(ErrorCode.DEPENDENCY, "%s failed: %s".formatted(collaborator, message), cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
