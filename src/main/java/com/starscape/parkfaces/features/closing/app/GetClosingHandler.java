package com.starscape.parkfaces.features.closing.app;

import com.starscape.parkfaces.common.exception.NotFoundException;
import com.starscape.parkfaces.features.closing.api.dto.ClosingReportItem;
import com.starscape.parkfaces.features.closing.api.dto.LastClosingResponse;
import com.starscape.parkfaces.features.closing.domain.ClosingReport;
import com.starscape.parkfaces.features.closing.domain.ClosingReportRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for single closing lookups.
 */
@Service
public class GetClosingHandler {
    
    private final ClosingReportRepository closingReportRepository;
    
    public GetClosingHandler(ClosingReportRepository closingReportRepository) {
        this.closingReportRepository = closingReportRepository;
    }
    
    @Transactional(readOnly = true)
    public ClosingReportItem handle(String closingId) {
        ClosingReport report = closingReportRepository.findById(closingId)
                .orElseThrow(() -> new NotFoundException("Closing not found: " + closingId));
        return ClosingReportItem.from(report);
    }
    
    /**
     * When the last closing happened, used by kiosks to show the current period start.
     */
    @Transactional(readOnly = true)
    public LastClosingResponse handleLast() {
        return closingReportRepository.findTopByOrderByClosedAtDesc()
                .map(report -> new LastClosingResponse(report.getClosedAt()))
                .orElseGet(() -> new LastClosingResponse(null));
    }
}
