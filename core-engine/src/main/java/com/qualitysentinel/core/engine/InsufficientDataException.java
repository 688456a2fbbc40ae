package com.qualitysentinel.core.engine;

/**
 * The entity has fewer data points than {@code dataProcessing.minDataPoints}.
 * Retry once more data has been recorded.
 */
public class InsufficientDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String entityId, int available, int required) {
        super(entityId, "Insufficient data points for entity '" + entityId + "': "
                + available + " < " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
