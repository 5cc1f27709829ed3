package com.starscape.parkfaces.features.photos.domain;

import java.util.List;
import java.util.Optional;

public interface PhotoRepository {
    <S extends Photo> S save(S photo);
    Optional<Photo> findById(String photoId);
    List<Photo> findAllById(Iterable<String> photoIds);
    boolean existsById(String photoId);
    void delete(Photo photo);

    /**
     * Load the photo and hold a row lock on it until the current transaction ends.
     */
    Optional<Photo> findByIdForUpdate(String photoId);
}
