package com.starscape.parkfaces.features.closing.app;

import com.starscape.parkfaces.features.closing.api.dto.ClosingReportItem;
import com.starscape.parkfaces.features.closing.domain.ClosingReportRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for the closing history, newest first.
 */
@Service
public class ListClosingsHandler {
    
    private final ClosingReportRepository closingReportRepository;
    
    public ListClosingsHandler(ClosingReportRepository closingReportRepository) {
        this.closingReportRepository = closingReportRepository;
    }
    
    @Transactional(readOnly = true)
    public List<ClosingReportItem> handle() {
        return closingReportRepository.findAllByOrderByClosedAtDesc().stream()
                .map(ClosingReportItem::from)
                .toList();
    }
}
