package com.starscape.parkfaces.features.closing.api;

import com.starscape.parkfaces.features.closing.api.dto.CloseDayRequest;
import com.starscape.parkfaces.features.closing.api.dto.ClosingResponse;
import com.starscape.parkfaces.features.closing.app.CloseDayHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class ClosingController {
    
    private final CloseDayHandler closeDayHandler;
    
    public ClosingController(CloseDayHandler closeDayHandler) {
        this.closeDayHandler = closeDayHandler;
    }
    
    /**
     * Close the day. All face descriptors are destroyed in the same commit.
     * 
     * @return 201 Created with the closing id and time
     */
    @PostMapping("/closings")
    public ResponseEntity<ClosingResponse> closeDay(@Valid @RequestBody CloseDayRequest request) {
        ClosingResponse response = closeDayHandler.handle(request.closingUser(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
