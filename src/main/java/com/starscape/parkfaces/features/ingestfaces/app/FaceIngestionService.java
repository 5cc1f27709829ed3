package com.starscape.parkfaces.features.ingestfaces.app;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.features.extraction.domain.DetectedFace;
import com.starscape.parkfaces.features.extraction.domain.ExtractionUnavailableException;
import com.starscape.parkfaces.features.extraction.domain.FaceEmbeddingExtractor;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptor;
import com.starscape.parkfaces.features.photos.domain.PhotoStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Extracts the faces of one stored photo and persists them as descriptors.
 * Runs on an ingestion worker thread; see {@link FaceIngestionWorkerPool}.
 */
@Service
public class FaceIngestionService {
    
    private static final Logger log = LoggerFactory.getLogger(FaceIngestionService.class);
    
    private final PhotoStorage photoStorage;
    private final FaceEmbeddingExtractor extractor;
    private final FaceDescriptorStore descriptorStore;
    private final AsyncTaskExecutor extractionExecutor;
    private final Duration extractionTimeout;
    
    public FaceIngestionService(
            PhotoStorage photoStorage,
            FaceEmbeddingExtractor extractor,
            FaceDescriptorStore descriptorStore,
            @Qualifier("faceExtractionExecutor") AsyncTaskExecutor extractionExecutor,
            FaceProperties faceProperties) {
        this.photoStorage = photoStorage;
        this.extractor = extractor;
        this.descriptorStore = descriptorStore;
        this.extractionExecutor = extractionExecutor;
        this.extractionTimeout = faceProperties.getIngestion().getExtractionTimeout();
    }
    
    /**
     * Ingest one photo: read it, extract faces, store one descriptor per face.
     * 
     * @param photoId The photo the faces belong to
     * @param fileReference Storage reference of the photo file
     * @return number of descriptors stored, 0 when no face was found
     */
    public int ingest(String photoId, String fileReference) {
        log.debug("Ingesting faces: photoId={}, fileReference={}", photoId, fileReference);
        
        byte[] image = photoStorage.read(fileReference);
        List<DetectedFace> faces = extractWithTimeout(photoId, image);
        
        if (faces.isEmpty()) {
            log.info("No faces found: photoId={}", photoId);
            return 0;
        }
        
        List<FaceDescriptor> stored = descriptorStore.addAll(photoId, faces);
        log.info("Stored face descriptors: photoId={}, faces={}", photoId, stored.size());
        return stored.size();
    }
    
    /**
     * Run the model call on the extraction pool and give up after the configured timeout.
     * A hung call is interrupted and reported as the extractor being unavailable.
     */
    private List<DetectedFace> extractWithTimeout(String photoId, byte[] image) {
        Future<List<DetectedFace>> future;
        try {
            future = extractionExecutor.submit(() -> extractor.extract(image));
        } catch (TaskRejectedException e) {
            throw new ExtractionUnavailableException("Extraction pool saturated, photo " + photoId + " skipped", e);
        }
        
        try {
            return future.get(extractionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionUnavailableException(
                "Face extraction timed out after " + extractionTimeout.toMillis() + " ms for photo " + photoId, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionUnavailableException("Interrupted while extracting faces for photo " + photoId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ExtractionUnavailableException("Face extraction failed for photo " + photoId, cause);
        }
    }
}
