package com.starscape.parkfaces.features.extraction.domain;

/**
 * Base class for failures of the face embedding model boundary.
 */
public abstract class FaceExtractionException extends RuntimeException {

    protected FaceExtractionException(String message) {
        super(message);
    }

    protected FaceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
