package com.starscape.parkfaces.features.ingestfaces.app;

/**
 * Thrown by {@link FaceIngestionWorkerPool#submit} once the ingestion pool has been shut down.
 */
public class IngestionShutdownException extends RuntimeException {

    private final String photoId;

    public IngestionShutdownException(String photoId, Throwable cause) {
        super("Face ingestion is shutting down, photo not queued: " + photoId, cause);
        this.photoId = photoId;
    }

    public String getPhotoId() {
        return photoId;
    }
}
