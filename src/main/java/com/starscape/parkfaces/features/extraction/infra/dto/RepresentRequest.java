package com.starscape.parkfaces.features.extraction.infra.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a DeepFace API /represent call. The image travels inline as a base64 data URI.
 */
public record RepresentRequest(
    @JsonProperty("img") String img,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("detector_backend") String detectorBackend,
    @JsonProperty("enforce_detection") boolean enforceDetection,
    @JsonProperty("align") boolean align
) {}
