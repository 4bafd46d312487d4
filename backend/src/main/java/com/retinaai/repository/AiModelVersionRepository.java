package com.retinaai.repository;

import com.retinaai.model.ai.AiModelVersion;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for AI model versions.
 */
@Repository
public interface AiModelVersionRepository extends JpaRepository<AiModelVersion, Long> {

    Optional<AiModelVersion> findFirstByActiveTrue();

    List<AiModelVersion> findByActiveTrue();

    List<AiModelVersion> findByVersion(String version);

    boolean existsByModelNameAndVersion(String modelName, String version);

    List<AiModelVersion> findAllByOrderByTrainedAtDesc();

    long countByActiveTrue();

    /**
     * Lock every version row, in id order, for the rest of the transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM AiModelVersion m ORDER BY m.id")
    List<AiModelVersion> findAllForUpdate();
}
