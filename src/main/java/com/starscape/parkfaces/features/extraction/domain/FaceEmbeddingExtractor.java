package com.starscape.parkfaces.features.extraction.domain;

import java.util.List;

/**
 * Boundary to the face detection and embedding model.
 *
 * <p>Implementations are constructed once, shared by all callers and must be thread-safe.
 */
public interface FaceEmbeddingExtractor {

    /**
     * Detect every face in an image and compute its embedding.
     *
     * <p>An image without faces is a normal outcome and yields an empty list.
     * Faces with a zero-width or zero-height box are never returned.
     *
     * @param image encoded image bytes (JPEG, PNG, ...)
     * @return detected faces in the order the model reports them
     * @throws UnreadableImageException if the bytes are not a decodable image
     * @throws ExtractionUnavailableException if the model cannot be reached or fails internally
     */
    List<DetectedFace> extract(byte[] image);

    /**
     * Cosine similarity between two embeddings produced by this extractor.
     *
     * @return a value in [-1, 1]
     * @throws DimensionMismatchException if the vectors differ in length
     */
    default double similarity(float[] v1, float[] v2) {
        return CosineSimilarity.between(v1, v2);
    }
}
