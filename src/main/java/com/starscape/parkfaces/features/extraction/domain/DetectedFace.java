package com.starscape.parkfaces.features.extraction.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One face found by the extractor: its embedding and where it sits in the image.
 * Plain class rather than a record so equality compares the embedding contents.
 */
public final class DetectedFace {

    private final float[] embedding;
    private final BoundingBox box;

    public DetectedFace(float[] embedding, BoundingBox box) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be empty");
        }
        this.embedding = embedding.clone();
        this.box = Objects.requireNonNull(box, "box");
    }

    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    public BoundingBox box() {
        return box;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectedFace other)) return false;
        return Arrays.equals(embedding, other.embedding) && box.equals(other.box);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(embedding) + box.hashCode();
    }

    @Override
    public String toString() {
        return "DetectedFace[dimension=" + embedding.length + ", box=" + box + "]";
    }
}
