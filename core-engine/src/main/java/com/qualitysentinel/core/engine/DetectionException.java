package com.qualitysentinel.core.engine;

/**
 * Base class of the recoverable errors a batch detection run reports to its
 * caller.
 *
 * @since 1.0.0
 */
public class DetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String entityId;

    public DetectionException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
