package com.starscape.parkfaces.features.ingestfaces.domain;

import java.util.List;

public interface FaceDescriptorRepository {
    <S extends FaceDescriptor> List<S> saveAll(Iterable<S> descriptors);
    List<FaceDescriptor> findAllByOrderByIdAsc();
    List<FaceDescriptor> findByPhotoId(String photoId);
    int deleteByPhotoId(String photoId);
    int deleteAllDescriptors();
    long count();
}
