package com.starscape.parkfaces.features.identify.app;

import com.starscape.parkfaces.common.config.FaceProperties;
import com.starscape.parkfaces.features.identify.api.dto.IdentifyMatch;
import com.starscape.parkfaces.features.identify.api.dto.IdentifyResponse;
import com.starscape.parkfaces.features.identify.domain.IdentificationResult;
import com.starscape.parkfaces.features.identify.domain.MatchResult;
import com.starscape.parkfaces.features.photos.domain.Photo;
import com.starscape.parkfaces.features.photos.domain.PhotoRepository;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Handler for identification queries.
 * Decodes the probe, runs the search and decorates matches with photo details.
 */
@Service
public class IdentifyHandler {
    
    static final String NO_FACE_MESSAGE = "no face detected";
    
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    
    private final SimilaritySearchEngine searchEngine;
    private final PhotoRepository photoRepository;
    private final FaceProperties faceProperties;
    
    public IdentifyHandler(
            SimilaritySearchEngine searchEngine,
            PhotoRepository photoRepository,
            FaceProperties faceProperties) {
        this.searchEngine = searchEngine;
        this.photoRepository = photoRepository;
        this.faceProperties = faceProperties;
    }
    
    public IdentifyResponse handle(String encodedImage) {
        byte[] probe = decodeImage(encodedImage);
        
        IdentificationResult result = searchEngine.identify(
            probe,
            faceProperties.getSearch().getThreshold(),
            faceProperties.getSearch().getTopK()
        );
        
        if (!result.faceDetected()) {
            return new IdentifyResponse(List.of(), NO_FACE_MESSAGE);
        }
        
        List<String> photoIds = result.matches().stream()
                .map(MatchResult::photoId)
                .distinct()
                .toList();
        Map<String, Photo> photos = photoRepository.findAllById(photoIds).stream()
                .collect(Collectors.toMap(Photo::getPhotoId, Function.identity()));
        
        // A photo deleted after the scan has taken its descriptors with it
        List<IdentifyMatch> matches = result.matches().stream()
                .filter(match -> photos.containsKey(match.photoId()))
                .map(match -> toMatch(match, photos.get(match.photoId())))
                .toList();
        
        return new IdentifyResponse(matches, null);
    }
    
    private IdentifyMatch toMatch(MatchResult match, Photo photo) {
        String date = photo.getCapturedAt() != null ? DATE_FORMAT.format(photo.getCapturedAt()) : null;
        return new IdentifyMatch(
            photo.getPhotoId(),
            match.similarity(),
            photo.getStorageKey(),
            date
        );
    }
    
    /**
     * Strip an optional data URI header and decode the base64 payload.
     */
    static byte[] decodeImage(String encodedImage) {
        if (encodedImage == null || encodedImage.isBlank()) {
            throw new IllegalArgumentException("Image is required");
        }
        String payload = encodedImage.trim();
        if (payload.startsWith("data:")) {
            int comma = payload.indexOf(',');
            if (comma < 0) {
                throw new IllegalArgumentException("Malformed data URI");
            }
            payload = payload.substring(comma + 1);
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(payload.replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Image is not valid base64", e);
        }
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Image is empty");
        }
        return bytes;
    }
}
