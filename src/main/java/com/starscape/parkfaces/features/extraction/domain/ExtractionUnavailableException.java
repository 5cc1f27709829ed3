package com.starscape.parkfaces.features.extraction.domain;

/**
 * Thrown when the face embedding service is unreachable, times out or fails internally.
 * The same request may succeed later.
 */
public class ExtractionUnavailableException extends FaceExtractionException {

    public ExtractionUnavailableException(String message) {
        super(message);
    }

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
