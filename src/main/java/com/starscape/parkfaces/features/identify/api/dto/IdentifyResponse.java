package com.starscape.parkfaces.features.identify.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response DTO for an identification query.
 * message is only present when the probe had no detectable face.
 */
public record IdentifyResponse(
    List<IdentifyMatch> results,
    @JsonInclude(JsonInclude.Include.NON_NULL) String message
) {}
