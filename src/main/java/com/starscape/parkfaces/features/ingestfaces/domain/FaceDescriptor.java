package com.starscape.parkfaces.features.ingestfaces.domain;

import com.starscape.parkfaces.features.extraction.domain.BoundingBox;
import com.starscape.parkfaces.features.ingestfaces.infra.EmbeddingConverter;
import com.starscape.parkfaces.features.photos.domain.Photo;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import java.time.Instant;

/**
 * Biometric descriptor of one face detected in one photo.
 * Deleting the photo row deletes its descriptors at the database level.
 */
@Entity
@Table(name = "face_descriptors", indexes = @Index(name = "idx_face_descriptors_photo_id", columnList = "photo_id"))
public class FaceDescriptor {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "descriptor_id")
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "photo_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Photo photo;
    
    @Column(name = "photo_id", insertable = false, updatable = false)
    private String photoId;
    
    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", nullable = false, columnDefinition = "text")
    private float[] embedding;
    
    @Column(nullable = false)
    private int dimension;
    
    @Column(name = "box_x", nullable = false)
    private int boxX;
    
    @Column(name = "box_y", nullable = false)
    private int boxY;
    
    @Column(name = "box_width", nullable = false)
    private int boxWidth;
    
    @Column(name = "box_height", nullable = false)
    private int boxHeight;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected FaceDescriptor() {
        // JPA constructor
    }
    
    public FaceDescriptor(Photo photo, float[] embedding, BoundingBox box) {
        if (photo == null) {
            throw new IllegalArgumentException("Photo is required");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be empty");
        }
        if (box == null) {
            throw new IllegalArgumentException("Bounding box is required");
        }
        this.photo = photo;
        this.photoId = photo.getPhotoId();
        this.embedding = embedding.clone();
        this.dimension = embedding.length;
        this.boxX = box.x();
        this.boxY = box.y();
        this.boxWidth = box.width();
        this.boxHeight = box.height();
        this.createdAt = Instant.now();
    }
    
    // Getters
    public Long getId() { return id; }
    public String getPhotoId() { return photoId; }
    public int getDimension() { return dimension; }
    public Instant getCreatedAt() { return createdAt; }
    
    public float[] getEmbedding() {
        return embedding.clone();
    }
    
    public BoundingBox getBox() {
        return new BoundingBox(boxX, boxY, boxWidth, boxHeight);
    }
}
