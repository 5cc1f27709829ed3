package com.starscape.parkfaces.features.ingestfaces.app;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.common.exception.NotFoundException;
import com.starscape.parkfaces.features.extraction.domain.DetectedFace;
import com.starscape.parkfaces.features.extraction.domain.DimensionMismatchException;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptor;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptorRepository;
import com.starscape.parkfaces.features.photos.domain.Photo;
import com.starscape.parkfaces.features.photos.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Shared store of face descriptors.
 *
 * <p>Inserts, reads and per-photo deletes run under the shared side of a read/write
 * lock and proceed concurrently. A purge runs under the exclusive side, so while it
 * is in progress no ingestion commits and no reader sees a half-purged table. The
 * lock is held until the surrounding transaction has committed.
 *
 * <p>The lock is process-local: a single application instance owns the descriptor table.
 */
@Component
public class FaceDescriptorStore {

    private static final Logger log = LoggerFactory.getLogger(FaceDescriptorStore.class);

    private final FaceDescriptorRepository descriptorRepository;
    private final PhotoRepository photoRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTransactionTemplate;
    private final int embeddingDimension;
    private final ReentrantReadWriteLock purgeLock = new ReentrantReadWriteLock(true);

    public FaceDescriptorStore(
            FaceDescriptorRepository descriptorRepository,
            PhotoRepository photoRepository,
            PlatformTransactionManager transactionManager,
            FaceProperties faceProperties) {
        this.descriptorRepository = descriptorRepository;
        this.photoRepository = photoRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTransactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTransactionTemplate.setReadOnly(true);
        this.embeddingDimension = faceProperties.getEmbeddingDimension();
    }

    /**
     * Store one descriptor per face, all in a single transaction.
     * Readers see either none or all of the photo's faces.
     *
     * <p>Descriptors the photo already has are replaced, so a redelivered upload
     * notification leaves exactly one row per detected face. Concurrent calls for the
     * same photo are serialized on the photo row.
     *
     * @throws NotFoundException if the photo row does not exist
     * @throws DimensionMismatchException if an embedding does not have the configured length
     */
    public List<FaceDescriptor> addAll(String photoId, List<DetectedFace> faces) {
        if (faces.isEmpty()) {
            return List.of();
        }
        for (DetectedFace face : faces) {
            if (face.dimension() != embeddingDimension) {
                throw new DimensionMismatchException(embeddingDimension, face.dimension());
            }
        }

        return withSharedAccess(() -> transactionTemplate.execute(status -> {
            photoRepository.findByIdForUpdate(photoId)
                    .orElseThrow(() -> new NotFoundException("Photo not found: " + photoId));
            int replaced = descriptorRepository.deleteByPhotoId(photoId);
            if (replaced > 0) {
                log.info("Replacing face descriptors: photoId={}, previous={}", photoId, replaced);
            }
            // The bulk delete clears the persistence context, so load the photo again
            Photo photo = photoRepository.findById(photoId)
                    .orElseThrow(() -> new NotFoundException("Photo not found: " + photoId));
            List<FaceDescriptor> descriptors = faces.stream()
                    .map(face -> new FaceDescriptor(photo, face.embedding(), face.box()))
                    .toList();
            return descriptorRepository.saveAll(descriptors);
        }));
    }

    public FaceDescriptor add(String photoId, DetectedFace face) {
        return addAll(photoId, List.of(face)).get(0);
    }

    /**
     * All live descriptors, ordered by ascending descriptor id.
     */
    public List<FaceDescriptor> all() {
        return withSharedAccess(() -> readOnlyTransactionTemplate.execute(
                status -> descriptorRepository.findAllByOrderByIdAsc()));
    }

    public List<FaceDescriptor> findByPhoto(String photoId) {
        return withSharedAccess(() -> readOnlyTransactionTemplate.execute(
                status -> descriptorRepository.findByPhotoId(photoId)));
    }

    public long count() {
        return withSharedAccess(() -> readOnlyTransactionTemplate.execute(
                status -> descriptorRepository.count()));
    }

    /**
     * Remove the descriptors of one photo, e.g. after its file was deleted from storage.
     *
     * @return number of descriptors removed
     */
    public int deleteByPhoto(String photoId) {
        int deleted = withSharedAccess(() -> transactionTemplate.execute(
                status -> descriptorRepository.deleteByPhotoId(photoId)));
        log.info("Deleted face descriptors: photoId={}, count={}", photoId, deleted);
        return deleted;
    }

    /**
     * Delete every descriptor.
     *
     * <p>Must be called from inside {@link #exclusively(Supplier)} and inside the transaction
     * that records the closing, so both commit or roll back together.
     *
     * @return number of descriptors removed
     */
    public int purgeAll() {
        if (!purgeLock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("purgeAll must run with exclusive access to the descriptor store");
        }
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("purgeAll requires an active transaction");
        }
        int deleted = descriptorRepository.deleteAllDescriptors();
        long remaining = descriptorRepository.count();
        if (remaining != 0) {
            throw new IllegalStateException("Descriptor purge left " + remaining + " rows behind");
        }
        return deleted;
    }

    /**
     * Run work while holding exclusive access. Blocks until in-flight inserts and reads finish.
     */
    public <T> T exclusively(Supplier<T> work) {
        purgeLock.writeLock().lock();
        try {
            return work.get();
        } finally {
            purgeLock.writeLock().unlock();
        }
    }

    private <T> T withSharedAccess(Supplier<T> work) {
        purgeLock.readLock().lock();
        try {
            return work.get();
        } finally {
            purgeLock.readLock().unlock();
        }
    }
}
