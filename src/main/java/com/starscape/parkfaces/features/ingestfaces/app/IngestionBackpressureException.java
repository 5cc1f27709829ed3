package com.starscape.parkfaces.features.ingestfaces.app;

/**
 * Thrown by {@link FaceIngestionWorkerPool#submit} when the ingestion queue is full.
 * The photo is not queued; the caller decides whether to retry later.
 */
public class IngestionBackpressureException extends RuntimeException {

    private final String photoId;

    public IngestionBackpressureException(String photoId, Throwable cause) {
        super("Face ingestion queue is full, photo not queued: " + photoId, cause);
        this.photoId = photoId;
    }

    public String getPhotoId() {
        return photoId;
    }
}
