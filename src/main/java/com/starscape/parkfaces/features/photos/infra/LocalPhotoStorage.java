package com.starscape.parkfaces.features.photos.infra;

import com.starscape.parkfaces.features.photos.domain.PhotoStorage;
import com.starscape.parkfaces.features.photos.domain.StoredPhotoNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem implementation of {@link PhotoStorage}.
 * File references are paths relative to the upload root, e.g. 2024-06-01/juan/img_001.jpg
 */
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalPhotoStorage implements PhotoStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalPhotoStorage.class);

    private final Path storageRoot;

    @Autowired
    public LocalPhotoStorage(@Value("${app.storage.local-root:uploads}") String storageRoot) {
        this(Paths.get(storageRoot));
    }

    public LocalPhotoStorage(Path storageRoot) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        log.info("LocalPhotoStorage reading from {}", this.storageRoot);
    }

    @Override
    public byte[] read(String fileReference) {
        Path filePath = resolve(fileReference);
        if (!Files.isRegularFile(filePath)) {
            throw new StoredPhotoNotFoundException(fileReference);
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read photo: " + fileReference, e);
        }
    }

    private Path resolve(String fileReference) {
        if (fileReference == null || fileReference.isBlank()) {
            throw new IllegalArgumentException("File reference cannot be blank");
        }
        Path resolved = storageRoot.resolve(fileReference).normalize();
        if (!resolved.startsWith(storageRoot)) {
            throw new IllegalArgumentException("File reference escapes the storage root: " + fileReference);
        }
        return resolved;
    }
}
