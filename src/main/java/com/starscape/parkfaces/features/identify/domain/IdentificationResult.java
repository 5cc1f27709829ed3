package com.starscape.parkfaces.features.identify.domain;

import java.util.List;

/**
 * Outcome of an identification query.
 *
 * <p>{@link Status#NO_FACE_DETECTED} means the probe itself had no face; it is distinct
 * from a probe whose face matched nothing, which is {@link Status#FACE_DETECTED} with
 * an empty match list.
 */
public record IdentificationResult(Status status, List<MatchResult> matches) {

    public enum Status {
        FACE_DETECTED,
        NO_FACE_DETECTED
    }

    public IdentificationResult {
        matches = List.copyOf(matches);
    }

    public static IdentificationResult noFace() {
        return new IdentificationResult(Status.NO_FACE_DETECTED, List.of());
    }

    public static IdentificationResult of(List<MatchResult> matches) {
        return new IdentificationResult(Status.FACE_DETECTED, matches);
    }

    public boolean faceDetected() {
        return status == Status.FACE_DETECTED;
    }
}
