package com.starscape.parkfaces.features.closing.app;

/**
 * A closing was aborted. Neither the closing record nor the descriptor purge was committed.
 */
public class PurgeFailureException extends RuntimeException {

    public PurgeFailureException(String message) {
        super(message);
    }

    public PurgeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
