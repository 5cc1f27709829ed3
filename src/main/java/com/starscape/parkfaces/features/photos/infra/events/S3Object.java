package com.starscape.parkfaces.features.photos.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Object section of an S3 EventBridge notification.
 * Size is absent on deletions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Object(
    @JsonProperty("key") String key,
    @JsonProperty("size") Long size,
    @JsonProperty("etag") String etag
) {}
