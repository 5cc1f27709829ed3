package com.starscape.parkfaces.features.photos.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.parkfaces.features.ingestfaces.app.FaceDescriptorStore;
import com.starscape.parkfaces.features.ingestfaces.app.FaceIngestionWorkerPool;
import com.starscape.parkfaces.features.ingestfaces.app.IngestionBackpressureException;
import com.starscape.parkfaces.features.photos.domain.PhotoRepository;
import com.starscape.parkfaces.features.photos.infra.events.S3EventMessage;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Listens to SQS messages carrying S3 object notifications from EventBridge.
 * New photo objects are queued for face ingestion; deleted ones lose their descriptors.
 * 
 * Only enabled when spring.cloud.aws.sqs.enabled=true and aws.sqs.queue-url is configured.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class S3EventListener {
    
    private static final Logger log = LoggerFactory.getLogger(S3EventListener.class);
    
    private final FaceIngestionWorkerPool workerPool;
    private final FaceDescriptorStore descriptorStore;
    private final PhotoRepository photoRepository;
    private final ObjectMapper objectMapper;
    
    public S3EventListener(
            FaceIngestionWorkerPool workerPool,
            FaceDescriptorStore descriptorStore,
            PhotoRepository photoRepository,
            ObjectMapper objectMapper) {
        this.workerPool = workerPool;
        this.descriptorStore = descriptorStore;
        this.photoRepository = photoRepository;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Handle one SQS message. Throwing leaves the message on the queue for redelivery,
     * which is what a full ingestion queue needs.
     */
    @SqsListener("${aws.sqs.queue-url}")
    public void handleS3Event(String message) {
        S3EventMessage event;
        try {
            event = objectMapper.readValue(message, S3EventMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse S3 event message", e);
            throw new IllegalArgumentException("Invalid message format", e);
        }
        
        if (event.detail() == null || event.detail().object() == null) {
            log.warn("Ignoring S3 event without object detail: id={}", event.id());
            return;
        }
        
        String s3Key = event.detail().object().key();
        
        // Thumbnails are derived files, faces are read from the original only
        if (s3Key.contains("/thumbnails/")) {
            log.debug("Skipping thumbnail file: {}", s3Key);
            return;
        }
        
        String photoId = extractPhotoIdFromS3Key(s3Key);
        if (photoId == null) {
            log.warn("Could not extract photoId from S3 key: {}", s3Key);
            return;
        }
        
        if (S3EventMessage.OBJECT_CREATED.equals(event.detailType())) {
            onObjectCreated(photoId, s3Key);
        } else if (S3EventMessage.OBJECT_DELETED.equals(event.detailType())) {
            descriptorStore.deleteByPhoto(photoId);
        } else {
            log.debug("Ignoring S3 event type: {}", event.detailType());
        }
    }
    
    private void onObjectCreated(String photoId, String s3Key) {
        if (!photoRepository.existsById(photoId)) {
            log.warn("Photo not found for photoId: {} (S3 key: {})", photoId, s3Key);
            return;
        }
        try {
            workerPool.submit(photoId, s3Key);
        } catch (IngestionBackpressureException e) {
            log.warn("Ingestion queue full, message will be redelivered: photoId={}", photoId);
            throw e;
        }
    }
    
    /**
     * S3 key format: env/photographer/photoId.ext
     * Returns the file name without its extension.
     */
    static String extractPhotoIdFromS3Key(String s3Key) {
        if (s3Key == null || s3Key.isBlank()) {
            return null;
        }
        int lastSlash = s3Key.lastIndexOf('/');
        String filename = s3Key.substring(lastSlash + 1);
        int lastDot = filename.lastIndexOf('.');
        String photoId = lastDot > 0 ? filename.substring(0, lastDot) : filename;
        return photoId.isBlank() ? null : photoId;
    }
}
