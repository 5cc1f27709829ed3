package com.starscape.parkfaces.features.photos.infra;

import com.starscape.parkfaces.features.photos.domain.Photo;
import com.starscape.parkfaces.features.photos.domain.PhotoRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, String>, PhotoRepository {
    
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Photo p WHERE p.photoId = :photoId")
    Optional<Photo> findByIdForUpdate(@Param("photoId") String photoId);
}
