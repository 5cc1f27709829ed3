package com.starscape.parkfaces.features.photos.domain;

public class StoredPhotoNotFoundException extends RuntimeException {

    public StoredPhotoNotFoundException(String fileReference) {
        super("No stored photo for reference: " + fileReference);
    }

    public StoredPhotoNotFoundException(String fileReference, Throwable cause) {
        super("No stored photo for reference: " + fileReference, cause);
    }
}
