package com.starscape.parkfaces.features.ingestfaces.app;

import com.starscape.parkfaces.features.photos.domain.events.PhotoStored;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Background face ingestion, decoupled from the upload request.
 *
 * <p>{@link #submit} only enqueues and returns. A fixed number of workers drain the
 * bounded queue; when it is full, submit fails fast with
 * {@link IngestionBackpressureException}.
 *
 * <p>A task that fails is logged and dropped. It is never retried, and the photo is
 * left with zero descriptors, which searches cannot tell apart from a photo without faces.
 */
@Service
public class FaceIngestionWorkerPool {
    
    private static final Logger log = LoggerFactory.getLogger(FaceIngestionWorkerPool.class);
    
    private final ThreadPoolTaskExecutor ingestionExecutor;
    private final FaceIngestionService ingestionService;
    
    public FaceIngestionWorkerPool(
            @Qualifier("faceIngestionExecutor") ThreadPoolTaskExecutor ingestionExecutor,
            FaceIngestionService ingestionService) {
        this.ingestionExecutor = ingestionExecutor;
        this.ingestionService = ingestionService;
    }
    
    /**
     * Queue a photo for face ingestion.
     * 
     * @param photoId The photo to ingest
     * @param fileReference Storage reference of the photo file
     * @throws IngestionBackpressureException if the queue is full
     * @throws IngestionShutdownException if the pool no longer accepts work
     */
    public void submit(String photoId, String fileReference) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (fileReference == null || fileReference.isBlank()) {
            throw new IllegalArgumentException("File reference cannot be blank");
        }
        
        try {
            ingestionExecutor.execute(() -> runTask(photoId, fileReference));
        } catch (TaskRejectedException e) {
            if (ingestionExecutor.getThreadPoolExecutor().isShutdown()) {
                log.warn("Face ingestion pool is shut down, rejecting photo: photoId={}", photoId);
                throw new IngestionShutdownException(photoId, e);
            }
            log.warn("Face ingestion queue full, rejecting photo: photoId={}, queued={}",
                    photoId, getQueuedTaskCount());
            throw new IngestionBackpressureException(photoId, e);
        }
        log.debug("Queued face ingestion: photoId={}", photoId);
    }
    
    /**
     * Upload subsystem hook. Runs once the transaction that stored the photo has committed,
     * so the worker can always find the photo row.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onPhotoStored(PhotoStored event) {
        try {
            submit(event.photoId(), event.fileReference());
        } catch (IngestionBackpressureException | IngestionShutdownException e) {
            // The upload already succeeded; the photo stays without descriptors
            log.warn("Photo stored but not queued for face ingestion: photoId={}, reason={}",
                    event.photoId(), e.getMessage());
        }
    }
    
    public int getQueuedTaskCount() {
        return ingestionExecutor.getThreadPoolExecutor().getQueue().size();
    }
    
    public int getActiveTaskCount() {
        return ingestionExecutor.getActiveCount();
    }
    
    private void runTask(String photoId, String fileReference) {
        try {
            ingestionService.ingest(photoId, fileReference);
        } catch (Exception e) {
            log.error("Face ingestion failed, photo left without descriptors: photoId={}", photoId, e);
        }
    }
}
