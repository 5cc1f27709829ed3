package com.starscape.parkfaces.features.extraction.infra;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.features.extraction.domain.BoundingBox;
import com.starscape.parkfaces.features.extraction.domain.DetectedFace;
import com.starscape.parkfaces.features.extraction.domain.ExtractionUnavailableException;
import com.starscape.parkfaces.features.extraction.domain.FaceEmbeddingExtractor;
import com.starscape.parkfaces.features.extraction.domain.UnreadableImageException;
import com.starscape.parkfaces.features.extraction.infra.dto.RepresentRequest;
import com.starscape.parkfaces.features.extraction.infra.dto.RepresentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

/**
 * {@link FaceEmbeddingExtractor} backed by a DeepFace API server (POST /represent).
 *
 * <p>Detection is not enforced on the server side, so "no face" comes back as an
 * empty result list or as a single whole-image placeholder with confidence 0.
 * Both end up as an empty list here.
 */
@Component
public class DeepFaceEmbeddingExtractor implements FaceEmbeddingExtractor {

    private static final Logger log = LoggerFactory.getLogger(DeepFaceEmbeddingExtractor.class);

    private final RestTemplate restTemplate;
    private final String representUrl;
    private final String modelName;
    private final String detectorBackend;
    private final double minFaceConfidence;

    public DeepFaceEmbeddingExtractor(RestTemplate extractorRestTemplate, FaceProperties faceProperties) {
        FaceProperties.Extractor config = faceProperties.getExtractor();
        this.restTemplate = extractorRestTemplate;
        this.representUrl = stripTrailingSlash(config.getBaseUrl()) + "/represent";
        this.modelName = config.getModelName();
        this.detectorBackend = config.getDetectorBackend();
        this.minFaceConfidence = config.getMinFaceConfidence();
    }

    @Override
    public List<DetectedFace> extract(byte[] image) {
        String formatName = detectFormat(image);

        RepresentRequest request = new RepresentRequest(
            toDataUri(image, formatName),
            modelName,
            detectorBackend,
            false,
            true
        );

        RepresentResponse response = post(request);
        if (response == null || response.results() == null) {
            return List.of();
        }

        List<DetectedFace> faces = new ArrayList<>();
        for (RepresentResponse.Representation representation : response.results()) {
            DetectedFace face = toDetectedFace(representation);
            if (face != null) {
                faces.add(face);
            }
        }
        log.debug("Extracted faces: model={}, reported={}, kept={}",
                modelName, response.results().size(), faces.size());
        return faces;
    }

    private RepresentResponse post(RepresentRequest request) {
        try {
            return restTemplate.postForObject(representUrl, request, RepresentResponse.class);
        } catch (ResourceAccessException e) {
            throw new ExtractionUnavailableException("Face embedding service is not reachable at " + representUrl, e);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.BAD_REQUEST.value() || status == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
                throw new UnreadableImageException("Face embedding service rejected the image: " + e.getStatusCode(), e);
            }
            throw new ExtractionUnavailableException("Face embedding service returned " + e.getStatusCode(), e);
        } catch (HttpServerErrorException e) {
            throw new ExtractionUnavailableException("Face embedding service failed: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new ExtractionUnavailableException("Face embedding call failed", e);
        }
    }

    /**
     * Convert one model result, or return null when it does not describe a usable face.
     */
    private DetectedFace toDetectedFace(RepresentResponse.Representation representation) {
        if (representation.embedding() == null || representation.embedding().length == 0) {
            return null;
        }
        RepresentResponse.FacialArea area = representation.facialArea();
        if (area == null || area.w() <= 0 || area.h() <= 0) {
            log.warn("Dropping face with degenerate bounding box: area={}", area);
            return null;
        }
        Double confidence = representation.faceConfidence();
        if (confidence != null && confidence <= minFaceConfidence) {
            log.debug("Dropping low-confidence face: confidence={}", confidence);
            return null;
        }
        // Detectors may place a box partly outside the frame
        BoundingBox box = new BoundingBox(Math.max(0, area.x()), Math.max(0, area.y()), area.w(), area.h());
        return new DetectedFace(representation.embedding(), box);
    }

    /**
     * Check the bytes carry a known image format before shipping them to the model.
     *
     * @return the ImageIO format name, lower case
     */
    private String detectFormat(byte[] image) {
        if (image == null || image.length == 0) {
            throw new UnreadableImageException("Image is empty");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(image))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new UnreadableImageException("Unsupported or corrupted image data");
            }
            ImageReader reader = readers.next();
            try {
                return reader.getFormatName().toLowerCase();
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new UnreadableImageException("Failed to read image", e);
        }
    }

    private String toDataUri(byte[] image, String formatName) {
        String mimeType = switch (formatName) {
            case "png" -> "image/png";
            case "gif" -> "image/gif";
            case "bmp" -> "image/bmp";
            default -> "image/jpeg";
        };
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(image);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
