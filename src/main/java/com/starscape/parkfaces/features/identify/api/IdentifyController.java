package com.starscape.parkfaces.features.identify.api;

import com.starscape.parkfaces.features.identify.api.dto.IdentifyRequest;
import com.starscape.parkfaces.features.identify.api.dto.IdentifyResponse;
import com.starscape.parkfaces.features.identify.app.IdentifyHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for face identification.
 * Answers "which photos contain this face" for a probe image.
 */
@RestController
@RequestMapping("/queries")
public class IdentifyController {
    
    private final IdentifyHandler identifyHandler;
    
    public IdentifyController(IdentifyHandler identifyHandler) {
        this.identifyHandler = identifyHandler;
    }
    
    @PostMapping("/identify")
    public ResponseEntity<IdentifyResponse> identify(@Valid @RequestBody IdentifyRequest request) {
        IdentifyResponse response = identifyHandler.handle(request.image());
        return ResponseEntity.ok(response);
    }
}
