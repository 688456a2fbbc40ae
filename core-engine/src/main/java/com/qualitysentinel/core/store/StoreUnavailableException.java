package com.qualitysentinel.core.store;

/**
 * Raised by a {@link MetricsStore} when a read or write cannot be completed.
 *
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
