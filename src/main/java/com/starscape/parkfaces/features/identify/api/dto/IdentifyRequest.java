package com.starscape.parkfaces.features.identify.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Probe image, base64 encoded. A data URI header such as
 * "data:image/jpeg;base64," is accepted and ignored.
 */
public record IdentifyRequest(
    @NotBlank(message = "Image is required")
    String image
) {}
