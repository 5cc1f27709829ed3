package com.starscape.parkfaces.features.ingestfaces.infra;

import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptor;
import com.starscape.parkfaces.features.ingestfaces.domain.FaceDescriptorRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaFaceDescriptorRepository extends JpaRepository<FaceDescriptor, Long>, FaceDescriptorRepository {
    
    List<FaceDescriptor> findAllByOrderByIdAsc();
    
    List<FaceDescriptor> findByPhotoId(String photoId);
    
    @Override
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FaceDescriptor d WHERE d.photoId = :photoId")
    int deleteByPhotoId(@Param("photoId") String photoId);
    
    @Override
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FaceDescriptor d")
    int deleteAllDescriptors();
}
