package com.starscape.parkfaces.features.identify.app;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.features.extraction.domain.CosineSimilarity;
import com.starscape.parkfaces.features.extraction.domain.DetectedFace;
import com.starscape.parkfaces.features.extraction.domain.DimensionMismatchException;
import com.starscape.parkfaces.features.extraction.domain.FaceEmbeddingExtractor;
import com.starscape.parkfaces.features.identify.domain.IdentificationResult;
import com.starscape.parkfaces.features.identify.domain.MatchResult;
import com.starscape.parkfaces.features.ingestfaces.app.FaceDescriptorStore;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the stored faces most similar to a probe face.
 *
 * <p>Every live descriptor is scored on each query, O(N * D) for N descriptors of
 * dimension D. That is fine for one day of park photos; a vector index would go
 * behind {@link #rank} without changing its results.
 */
@Service
public class SimilaritySearchEngine {
    
    private static final Logger log = LoggerFactory.getLogger(SimilaritySearchEngine.class);
    
    private static final Comparator<MatchResult> MOST_SIMILAR_FIRST =
            Comparator.comparingDouble(MatchResult::similarity).reversed()
                    .thenComparingLong(MatchResult::descriptorId);
    
    private final FaceEmbeddingExtractor extractor;
    private final FaceDescriptorStore descriptorStore;
    private final int embeddingDimension;
    
    public SimilaritySearchEngine(
            FaceEmbeddingExtractor extractor,
            FaceDescriptorStore descriptorStore,
            FaceProperties faceProperties) {
        this.extractor = extractor;
        this.descriptorStore = descriptorStore;
        this.embeddingDimension = faceProperties.getEmbeddingDimension();
    }
    
    /**
     * Identify the photos containing the face in a probe image.
     * Only the first face the extractor reports is used when the probe shows several.
     * 
     * @param probeImage encoded image bytes
     * @param threshold scores must be strictly greater than this
     * @param topK maximum number of matches
     * @return matches most similar first, or a no-face result
     */
    public IdentificationResult identify(byte[] probeImage, double threshold, int topK) {
        List<DetectedFace> faces = extractor.extract(probeImage);
        if (faces.isEmpty()) {
            log.info("Identification probe has no detectable face");
            return IdentificationResult.noFace();
        }
        if (faces.size() > 1) {
            log.debug("Probe has {} faces, using the first", faces.size());
        }
        
        List<MatchResult> matches = rank(faces.get(0).embedding(), threshold, topK);
        log.info("Identification finished: matches={}, threshold={}, topK={}", matches.size(), threshold, topK);
        return IdentificationResult.of(matches);
    }
    
    /**
     * Score a probe embedding against every live descriptor.
     * 
     * @throws DimensionMismatchException if the probe or any stored embedding has the wrong length
     */
    public List<MatchResult> rank(float[] probe, double threshold, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        if (probe.length != embeddingDimension) {
            throw new DimensionMismatchException(embeddingDimension, probe.length);
        }
        
        List<MatchResult> candidates = new ArrayList<>();
        for (FaceDescriptor descriptor : descriptorStore.all()) {
            double score = CosineSimilarity.between(descriptor.getEmbedding(), probe);
            if (score > threshold) {
                candidates.add(new MatchResult(
                    descriptor.getId(),
                    descriptor.getPhotoId(),
                    score,
                    descriptor.getBox()
                ));
            }
        }
        
        candidates.sort(MOST_SIMILAR_FIRST);
        return candidates.size() > topK ? List.copyOf(candidates.subList(0, topK)) : candidates;
    }
}
