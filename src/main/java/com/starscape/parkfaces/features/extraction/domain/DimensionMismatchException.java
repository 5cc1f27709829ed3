package com.starscape.parkfaces.features.extraction.domain;

/**
 * Two embeddings that should come from the same model have different lengths.
 * Usually means descriptors stored by an older model survived a model upgrade.
 */
public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Embedding dimension mismatch: expected %d, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
