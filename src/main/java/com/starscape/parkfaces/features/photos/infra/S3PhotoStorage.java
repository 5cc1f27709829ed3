package com.starscape.parkfaces.features.photos.infra;

import com.starscape.parkfaces.features.photos.domain.PhotoStorage;
import com.starscape.parkfaces.features.photos.domain.StoredPhotoNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * S3 implementation of {@link PhotoStorage}. File references are object keys in the configured bucket.
 */
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class S3PhotoStorage implements PhotoStorage {
    
    private static final Logger log = LoggerFactory.getLogger(S3PhotoStorage.class);
    
    private final S3Client s3Client;
    private final String bucket;
    
    public S3PhotoStorage(S3Client s3Client, @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }
    
    @Override
    public byte[] read(String fileReference) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(fileReference)
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            byte[] bytes = response.readAllBytes();
            log.debug("Downloaded photo from S3: bucket={}, key={}, bytes={}", bucket, fileReference, bytes.length);
            return bytes;
        } catch (NoSuchKeyException e) {
            throw new StoredPhotoNotFoundException(fileReference, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to download photo from S3: " + fileReference, e);
        }
    }
}
