package com.starscape.parkfaces.features.closing.api;

import com.starscape.parkfaces.features.closing.api.dto.ClosingReportItem;
import com.starscape.parkfaces.features.closing.api.dto.LastClosingResponse;
import com.starscape.parkfaces.features.closing.app.GetClosingHandler;
import com.starscape.parkfaces.features.closing.app.ListClosingsHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for querying closing history.
 */
@RestController
@RequestMapping("/queries/closings")
public class ClosingQueryController {
    
    private final ListClosingsHandler listClosingsHandler;
    private final GetClosingHandler getClosingHandler;
    
    public ClosingQueryController(
            ListClosingsHandler listClosingsHandler,
            GetClosingHandler getClosingHandler) {
        this.listClosingsHandler = listClosingsHandler;
        this.getClosingHandler = getClosingHandler;
    }
    
    @GetMapping
    public ResponseEntity<List<ClosingReportItem>> listClosings() {
        return ResponseEntity.ok(listClosingsHandler.handle());
    }
    
    @GetMapping("/last")
    public ResponseEntity<LastClosingResponse> getLastClosing() {
        return ResponseEntity.ok(getClosingHandler.handleLast());
    }
    
    @GetMapping("/{closingId}")
    public ResponseEntity<ClosingReportItem> getClosing(@PathVariable String closingId) {
        return ResponseEntity.ok(getClosingHandler.handle(closingId));
    }
}
