package com.starscape.parkfaces.features.closing.app;

import com.starscape.parkfaces.features.closing.api.dto.ClosingResponse;
import com.starscape.parkfaces.features.closing.domain.ClosingReport;
import com.starscape.parkfaces.features.closing.domain.ClosingReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Handler for closing the day.
 * Records the closing report and purges face descriptors in the same commit.
 */
@Service
public class CloseDayHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CloseDayHandler.class);
    
    private final ClosingReportRepository closingReportRepository;
    private final PrivacyPurgeCoordinator purgeCoordinator;
    
    public CloseDayHandler(
            ClosingReportRepository closingReportRepository,
            PrivacyPurgeCoordinator purgeCoordinator) {
        this.closingReportRepository = closingReportRepository;
        this.purgeCoordinator = purgeCoordinator;
    }
    
    public ClosingResponse handle(String closingUser, String notes) {
        String closingId = "cls_" + UUID.randomUUID().toString().replace("-", "");
        log.info("Closing day: closingId={}, closingUser={}", closingId, closingUser);
        
        ClosingPurgeOutcome outcome = purgeCoordinator.purgeOnClosing(
            () -> closingReportRepository.save(new ClosingReport(closingId, closingUser, notes)).toRecord()
        );
        
        return new ClosingResponse(outcome.closingId(), outcome.closedAt());
    }
}
