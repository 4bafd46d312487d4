package com.retinaai.repository;

import com.retinaai.model.enums.ImageStatus;
import com.retinaai.model.imaging.RetinalImage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for retinal images.
 */
@Repository
public interface RetinalImageRepository extends JpaRepository<RetinalImage, Long> {

    List<RetinalImage> findByPatientIdOrderByUploadTimeDesc(Long patientId);

    List<RetinalImage> findByClinicIdOrderByUploadTimeDesc(Long clinicId);

    List<RetinalImage> findByStatus(ImageStatus status);

    /**
     * Load an image and hold a write lock on its row until the transaction ends.
     * Used to serialize analysis submission per image.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM RetinalImage i WHERE i.id = :id")
    Optional<RetinalImage> findByIdForUpdate(@Param("id") Long id);
}
