package com.starscape.parkfaces.features.identify.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IdentifyMatch(
    @JsonProperty("photo_id") String photoId,
    double similarity,
    String path,
    String date
) {}
