package com.starscape.parkfaces.features.identify.app;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.features.extraction.domain.BoundingBox;
import com.starscape.parkfaces.features.extraction.domain.CosineSimilarity;
import com.starscape.parkfaces.features.extraction.domain.DimensionMismatchException;
import com.starscape.parkfaces.features.extraction.domain.ExtractionUnavailableException;
import com.starscape.parkfaces.features.extraction.domain.FaceEmbeddingExtractor;
import com.starscape.parkfaces.features.identify.domain.IdentificationResult;
import com.starscape.parkfaces.features.identify.domain.MatchResult;
import com.starscape.parkfaces.features.ingestfaces.app.FaceDescriptorStore;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptor;
import com.starscape.parkfaces.features.photos.domain.Photo;
import com.starscape.parkfaces.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimilaritySearchEngineTest {

    private static final float[] PROBE = {1f, 0f, 0f, 0f};

    @Mock
    private FaceEmbeddingExtractor extractor;
    @Mock
    private FaceDescriptorStore descriptorStore;

    private SimilaritySearchEngine engine;
    private final byte[] probeImage = "probe".getBytes();

    @BeforeEach
    void setUp() {
        FaceProperties properties = new FaceProperties();
        properties.setEmbeddingDimension(4);
        engine = new SimilaritySearchEngine(extractor, descriptorStore, properties);
    }

    @Test
    @DisplayName("Exact embedding match is the sole top result with similarity 1.0")
    void exactMatch() {
        when(extractor.extract(probeImage)).thenReturn(List.of(TestImages.face(PROBE)));
        when(descriptorStore.all()).thenReturn(List.of(
                descriptor(1L, "ph_match", PROBE),
                descriptor(2L, "ph_other", new float[]{0f, 1f, 0f, 0f})
        ));

        IdentificationResult result = engine.identify(probeImage, 0.65, 20);

        assertTrue(result.faceDetected());
        assertEquals(1, result.matches().size());
        assertEquals("ph_match", result.matches().get(0).photoId());
        assertEquals(1.0, result.matches().get(0).similarity(), 1e-6);
        assertEquals(new BoundingBox(10, 20, 64, 64), result.matches().get(0).box());
    }

    @Test
    @DisplayName("Probe without a face yields NO_FACE_DETECTED and never scans the store")
    void noFace() {
        when(extractor.extract(probeImage)).thenReturn(List.of());

        IdentificationResult result = engine.identify(probeImage, 0.65, 20);

        assertEquals(IdentificationResult.Status.NO_FACE_DETECTED, result.status());
        assertTrue(result.matches().isEmpty());
        verifyNoInteractions(descriptorStore);
    }

    @Test
    @DisplayName("Face detected but nothing above threshold is an empty FACE_DETECTED result")
    void noMatches() {
        when(extractor.extract(probeImage)).thenReturn(List.of(TestImages.face(PROBE)));
        when(descriptorStore.all()).thenReturn(List.of(descriptor(1L, "ph_1", new float[]{0f, 0f, 1f, 0f})));

        IdentificationResult result = engine.identify(probeImage, 0.65, 20);

        assertEquals(IdentificationResult.Status.FACE_DETECTED, result.status());
        assertTrue(result.matches().isEmpty());
    }

    @Test
    @DisplayName("Only the first face of a multi-face probe is used")
    void firstFaceOnly() {
        when(extractor.extract(probeImage)).thenReturn(List.of(
                TestImages.face(0f, 1f, 0f, 0f),
                TestImages.face(PROBE)
        ));
        when(descriptorStore.all()).thenReturn(List.of(
                descriptor(1L, "ph_a", PROBE),
                descriptor(2L, "ph_b", new float[]{0f, 1f, 0f, 0f})
        ));

        List<MatchResult> matches = engine.identify(probeImage, 0.65, 20).matches();

        assertEquals(1, matches.size());
        assertEquals("ph_b", matches.get(0).photoId());
    }

    @Test
    @DisplayName("A score equal to the threshold is excluded")
    void thresholdIsStrict() {
        float[] stored = {1f, 1f, 0f, 0f};
        double score = CosineSimilarity.between(stored, PROBE);
        when(descriptorStore.all()).thenReturn(List.of(descriptor(1L, "ph_1", stored)));

        assertTrue(engine.rank(PROBE, score, 20).isEmpty());
        assertEquals(1, engine.rank(PROBE, score - 1e-6, 20).size());
    }

    @Test
    @DisplayName("Results are sorted by score, ties broken by ascending descriptor id")
    void orderingAndTies() {
        when(descriptorStore.all()).thenReturn(List.of(
                descriptor(7L, "ph_tie_late", new float[]{0.9f, 0.1f, 0f, 0f}),
                descriptor(3L, "ph_best", PROBE),
                descriptor(5L, "ph_tie_early", new float[]{0.9f, 0.1f, 0f, 0f}),
                descriptor(1L, "ph_low", new float[]{0.8f, 0.5f, 0f, 0f})
        ));

        List<MatchResult> matches = engine.rank(PROBE, 0.65, 20);

        assertEquals(List.of("ph_best", "ph_tie_early", "ph_tie_late", "ph_low"),
                matches.stream().map(MatchResult::photoId).toList());
        for (int i = 1; i < matches.size(); i++) {
            assertTrue(matches.get(i - 1).similarity() >= matches.get(i).similarity());
        }
    }

    @Test
    @DisplayName("25 matches above threshold are truncated to the 20 highest")
    void topK() {
        List<FaceDescriptor> stored = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            // Larger i means a larger off-axis component and a lower score
            stored.add(descriptor(i, "ph_" + i, new float[]{1f, i * 0.01f, 0f, 0f}));
        }
        when(descriptorStore.all()).thenReturn(stored);

        List<MatchResult> matches = engine.rank(PROBE, 0.65, 20);

        assertEquals(20, matches.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i + 1, matches.get(i).descriptorId());
        }
    }

    @Test
    @DisplayName("Probe of the wrong length fails fast")
    void probeDimensionMismatch() {
        assertThrows(DimensionMismatchException.class, () -> engine.rank(new float[]{1f, 0f}, 0.65, 20));
        verifyNoInteractions(descriptorStore);
    }

    @Test
    @DisplayName("Stored embedding of the wrong length fails fast instead of being skipped")
    void storedDimensionMismatch() {
        when(descriptorStore.all()).thenReturn(List.of(
                descriptor(1L, "ph_ok", PROBE),
                descriptor(2L, "ph_old_model", new float[]{1f, 0f, 0f})
        ));

        assertThrows(DimensionMismatchException.class, () -> engine.rank(PROBE, 0.65, 20));
    }

    @Test
    @DisplayName("Extractor outage surfaces to the caller")
    void extractorUnavailable() {
        when(extractor.extract(probeImage)).thenThrow(new ExtractionUnavailableException("down"));

        assertThrows(ExtractionUnavailableException.class, () -> engine.identify(probeImage, 0.65, 20));
    }

    @Test
    @DisplayName("Non-positive topK is rejected")
    void invalidTopK() {
        assertThrows(IllegalArgumentException.class, () -> engine.rank(PROBE, 0.65, 0));
    }

    private static FaceDescriptor descriptor(long id, String photoId, float[] embedding) {
        Photo photo = new Photo(photoId, photoId + ".jpg", "2024-06-01/" + photoId + ".jpg", "ana");
        FaceDescriptor descriptor = new FaceDescriptor(photo, embedding, new BoundingBox(10, 20, 64, 64));
        ReflectionTestUtils.setField(descriptor, "id", id);
        return descriptor;
    }
}
