package com.starscape.parkfaces.features.closing.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CloseDayRequest(
    @NotBlank(message = "Closing user is required")
    @Size(max = 255, message = "Closing user must be at most 255 characters")
    String closingUser,
    
    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    String notes
) {}
