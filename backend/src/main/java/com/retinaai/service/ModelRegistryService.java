package com.retinaai.service;

import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiModelVersion;
import com.retinaai.model.ai.ModelVersionUpdate;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.AiModelVersionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Model Registry Service
 *
 * Tracks AI model versions and the single active one:
 * - The first version registered into an empty registry becomes active
 * - Activation clears every other active flag in the same transaction
 * - The active version cannot be deleted
 *
 * Mutations run under a registry lock that is held until their transaction
 * has committed, and activation additionally locks all version rows.
 */
@Service
@Slf4j
public class ModelRegistryService {

    private final AiModelVersionRepository modelVersionRepository;
    private final AiAnalysisRepository analysisRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ReentrantLock registryLock = new ReentrantLock();

    public ModelRegistryService(
            AiModelVersionRepository modelVersionRepository,
            AiAnalysisRepository analysisRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.modelVersionRepository = modelVersionRepository;
        this.analysisRepository = analysisRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Register a new model version. Inactive unless the registry was empty.
     */
    public AiModelVersion register(String modelName, String version, String thresholdConfig) {
        requireText(modelName, "Model name");
        requireText(version, "Version");
        requireText(thresholdConfig, "Threshold configuration");

        return inRegistryTransaction(() -> {
            if (modelVersionRepository.existsByModelNameAndVersion(modelName.trim(), version.trim())) {
                throw new ConflictException("Model version already registered: " + modelName + " " + version);
            }

            boolean firstVersion = modelVersionRepository.count() == 0;
            AiModelVersion saved = modelVersionRepository.save(AiModelVersion.builder()
                .modelName(modelName.trim())
                .version(version.trim())
                .thresholdConfig(thresholdConfig)
                .trainedAt(LocalDateTime.now(clock))
                .active(firstVersion)
                .build());

            log.info("Registered model version {} {} (id={}, active={})",
                saved.getModelName(), saved.getVersion(), saved.getId(), saved.isActive());
            return saved;
        });
    }

    /**
     * Make the given version the only active one.
     */
    public AiModelVersion activate(Long id) {
        return inRegistryTransaction(() -> {
            List<AiModelVersion> versions = modelVersionRepository.findAllForUpdate();
            AiModelVersion target = versions.stream()
                .filter(v -> v.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Model version not found: " + id));

            for (AiModelVersion version : versions) {
                version.setActive(version.getId().equals(id));
            }
            modelVersionRepository.saveAll(versions);

            log.info("Activated model version {} {} (id={})", target.getModelName(), target.getVersion(), id);
            return target;
        });
    }

    /**
     * Update the mutable fields of a model version.
     */
    public AiModelVersion update(Long id, ModelVersionUpdate update) {
        return inRegistryTransaction(() -> {
            AiModelVersion existing = modelVersionRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Model version not found: " + id));

            if (update.modelName() != null) {
                requireText(update.modelName(), "Model name");
                if (!update.modelName().trim().equals(existing.getModelName())
                        && modelVersionRepository.existsByModelNameAndVersion(update.modelName().trim(), existing.getVersion())) {
                    throw new ConflictException("Model version already registered: "
                        + update.modelName() + " " + existing.getVersion());
                }
                existing.setModelName(update.modelName().trim());
            }
            if (update.thresholdConfig() != null) {
                requireText(update.thresholdConfig(), "Threshold configuration");
                existing.setThresholdConfig(update.thresholdConfig());
            }
            return modelVersionRepository.save(existing);
        });
    }

    /**
     * Delete an inactive model version that no analysis references.
     */
    public void delete(Long id) {
        inRegistryTransaction(() -> {
            AiModelVersion existing = modelVersionRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Model version not found: " + id));

            if (existing.isActive()) {
                throw new ConflictException("Cannot delete the active model version. Activate another version first.");
            }
            if (analysisRepository.existsByModelVersionId(id)) {
                throw new ConflictException("Model version " + id + " is referenced by analyses");
            }

            modelVersionRepository.delete(existing);
            log.info("Deleted model version {} {} (id={})", existing.getModelName(), existing.getVersion(), id);
            return null;
        });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * The active version, or NotFoundException when the registry is empty.
     */
    @Transactional(readOnly = true)
    public AiModelVersion getActive() {
        return findActive()
            .orElseThrow(() -> new NotFoundException("No active model version"));
    }

    @Transactional(readOnly = true)
    public Optional<AiModelVersion> findActive() {
        return modelVersionRepository.findFirstByActiveTrue();
    }

    @Transactional(readOnly = true)
    public AiModelVersion getById(Long id) {
        return modelVersionRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Model version not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<AiModelVersion> findAll() {
        return modelVersionRepository.findAllByOrderByTrainedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<AiModelVersion> findByVersion(String version) {
        return modelVersionRepository.findByVersion(version);
    }

    @Transactional(readOnly = true)
    public long count() {
        return modelVersionRepository.count();
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private <T> T inRegistryTransaction(Supplier<T> action) {
        registryLock.lock();
        try {
            return transactionTemplate.execute(status -> action.get());
        } finally {
            registryLock.unlock();
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
