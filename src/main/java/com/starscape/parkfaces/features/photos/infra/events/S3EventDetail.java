package com.starscape.parkfaces.features.photos.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record S3EventDetail(
    @JsonProperty("bucket") S3Bucket bucket,
    @JsonProperty("object") S3Object object,
    @JsonProperty("reason") String reason
) {}
