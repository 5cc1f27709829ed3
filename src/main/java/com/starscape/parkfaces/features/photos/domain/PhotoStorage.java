package com.starscape.parkfaces.features.photos.domain;

/**
 * Resolves a file reference handed over by the upload subsystem to the image bytes.
 */
public interface PhotoStorage {

    /**
     * Read the full content of a stored photo.
     *
     * @param fileReference storage key of the photo, as recorded at upload time
     * @return raw image bytes
     * @throws StoredPhotoNotFoundException if nothing is stored under the reference
     */
    byte[] read(String fileReference);
}
