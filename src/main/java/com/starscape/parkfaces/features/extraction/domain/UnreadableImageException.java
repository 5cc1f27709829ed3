package com.starscape.parkfaces.features.extraction.domain;

/**
 * Thrown when the supplied bytes cannot be decoded as an image. Retrying will not help.
 */
public class UnreadableImageException extends FaceExtractionException {

    public UnreadableImageException(String message) {
        super(message);
    }

    public UnreadableImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
