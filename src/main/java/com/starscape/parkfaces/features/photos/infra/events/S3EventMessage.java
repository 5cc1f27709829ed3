package com.starscape.parkfaces.features.photos.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Top-level EventBridge envelope delivered through SQS.
 * detail-type is "Object Created" or "Object Deleted".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3EventMessage(
    @JsonProperty("id") String id,
    @JsonProperty("detail-type") String detailType,
    @JsonProperty("source") String source,
    @JsonProperty("time") String time,
    @JsonProperty("detail") S3EventDetail detail
) {
    public static final String OBJECT_CREATED = "Object Created";
    public static final String OBJECT_DELETED = "Object Deleted";
}
