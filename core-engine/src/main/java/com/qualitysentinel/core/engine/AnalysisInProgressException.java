package com.qualitysentinel.core.engine;

/**
 * A detection run for the same entity is already in flight. Runs are not
 * queued; the caller should retry later.
 */
public class AnalysisInProgressException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public AnalysisInProgressException(String entityId) {
        super(entityId, "Analysis already in progress for entity: " + entityId);
    }
}
