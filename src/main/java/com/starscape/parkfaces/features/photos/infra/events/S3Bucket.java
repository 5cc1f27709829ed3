package com.starscape.parkfaces.features.photos.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Bucket(
    @JsonProperty("name") String name
) {}
