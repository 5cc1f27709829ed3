package com.starscape.parkfaces.features.closing.app;

import com.starscape.parkfaces.features.closing.domain.ClosingRecord;
import com.starscape.parkfaces.features.closing.domain.ClosingWriter;
import com.starscape.parkfaces.features.ingestfaces.app.FaceDescriptorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Destroys every face descriptor as part of an accounting closing.
 *
 * <p>The closing record and the purge run in one transaction while the descriptor store
 * is held exclusively. Either both are committed or neither is; there is no state with a
 * recorded closing and live descriptors from before it.
 *
 * <p>Idle -> Purging -> Idle. A closing requested while another one is purging is rejected.
 */
@Service
public class PrivacyPurgeCoordinator {
    
    private static final Logger log = LoggerFactory.getLogger(PrivacyPurgeCoordinator.class);
    
    public enum PurgeState {
        IDLE,
        PURGING
    }
    
    private final FaceDescriptorStore descriptorStore;
    private final TransactionTemplate transactionTemplate;
    private final AtomicReference<PurgeState> state = new AtomicReference<>(PurgeState.IDLE);
    
    public PrivacyPurgeCoordinator(
            FaceDescriptorStore descriptorStore,
            PlatformTransactionManager transactionManager) {
        this.descriptorStore = descriptorStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }
    
    /**
     * Write the closing and purge all descriptors as one unit of work.
     * 
     * @param closingWriter writes the closing summary inside the purge transaction
     * @return what was committed
     * @throws PurgeFailureException if anything failed; nothing was committed
     */
    public ClosingPurgeOutcome purgeOnClosing(ClosingWriter closingWriter) {
        if (!state.compareAndSet(PurgeState.IDLE, PurgeState.PURGING)) {
            throw new PurgeFailureException("A closing is already in progress");
        }
        
        try {
            ClosingPurgeOutcome outcome = descriptorStore.exclusively(() -> transactionTemplate.execute(status -> {
                ClosingRecord record = closingWriter.commit();
                if (record == null) {
                    throw new IllegalStateException("Closing writer returned no record");
                }
                int purged = descriptorStore.purgeAll();
                return new ClosingPurgeOutcome(record.closingId(), record.closedAt(), purged);
            }));
            
            log.info("Closing committed, face descriptors purged: closingId={}, purged={}",
                    outcome.closingId(), outcome.purgedDescriptors());
            return outcome;
        } catch (RuntimeException e) {
            log.error("Closing aborted, closing record and descriptor purge rolled back", e);
            throw new PurgeFailureException("Closing aborted: " + e.getMessage(), e);
        } finally {
            state.set(PurgeState.IDLE);
        }
    }
    
    public PurgeState getState() {
        return state.get();
    }
}
