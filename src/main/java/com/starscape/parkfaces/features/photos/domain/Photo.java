package com.starscape.parkfaces.features.photos.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A photograph taken in the park.
 * Rows are written by the upload subsystem; the face pipeline only reads the
 * identifier, the storage key and the capture time.
 */
@Entity
@Table(name = "photos")
public class Photo {
    
    @Id
    @Column(name = "photo_id")
    private String photoId;
    
    @Column(nullable = false)
    private String filename;
    
    @Column(name = "storage_key", nullable = false, length = 500)
    private String storageKey;
    
    @Column(name = "photographer")
    private String photographer;
    
    @Column(name = "captured_at", nullable = false, updatable = false)
    private Instant capturedAt;
    
    protected Photo() {
        // JPA constructor
    }
    
    public Photo(String photoId, String filename, String storageKey, String photographer) {
        this(photoId, filename, storageKey, photographer, Instant.now());
    }
    
    public Photo(String photoId, String filename, String storageKey, String photographer, Instant capturedAt) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be blank");
        }
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("Storage key cannot be blank");
        }
        if (capturedAt == null) {
            throw new IllegalArgumentException("Capture time is required");
        }
        this.photoId = photoId;
        this.filename = filename;
        this.storageKey = storageKey;
        this.photographer = photographer;
        this.capturedAt = capturedAt;
    }
    
    // Getters
    public String getPhotoId() { return photoId; }
    public String getFilename() { return filename; }
    public String getStorageKey() { return storageKey; }
    public String getPhotographer() { return photographer; }
    public Instant getCapturedAt() { return capturedAt; }
}
