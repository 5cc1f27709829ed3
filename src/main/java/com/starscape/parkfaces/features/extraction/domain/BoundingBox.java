package com.starscape.parkfaces.features.extraction.domain;

/**
 * Pixel rectangle locating a face inside its photograph.
 */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (x < 0 || y < 0 || width < 0 || height < 0) {
            throw new IllegalArgumentException(
                String.format("Bounding box values must be non-negative: x=%d, y=%d, w=%d, h=%d", x, y, width, height));
        }
    }

    /**
     * A box with no area cannot hold a face.
     */
    public boolean isDegenerate() {
        return width == 0 || height == 0;
    }
}
