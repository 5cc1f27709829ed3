package com.starscape.parkfaces.features.extraction.infra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RepresentResponse(
    @JsonProperty("results") List<Representation> results
) {

    /**
     * One detected face: embedding plus facial area in pixels.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Representation(
        @JsonProperty("embedding") float[] embedding,
        @JsonProperty("facial_area") FacialArea facialArea,
        @JsonProperty("face_confidence") Double faceConfidence
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FacialArea(
        @JsonProperty("x") int x,
        @JsonProperty("y") int y,
        @JsonProperty("w") int w,
        @JsonProperty("h") int h
    ) {}
}
