package com.retinaai.service;

import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.enums.EyeSide;
import com.retinaai.model.enums.ImageStatus;
import com.retinaai.model.enums.ImageType;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.RetinalImageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Registers uploaded retinal images and exposes them for analysis.
 * Image status is left to the analysis orchestrator.
 */
@Service
@Transactional
@Slf4j
public class RetinalImageService {

    private final RetinalImageRepository imageRepository;
    private final AiAnalysisRepository analysisRepository;
    private final Clock clock;

    public RetinalImageService(
            RetinalImageRepository imageRepository,
            AiAnalysisRepository analysisRepository,
            Clock clock) {
        this.imageRepository = imageRepository;
        this.analysisRepository = analysisRepository;
        this.clock = clock;
    }

    /**
     * Register a newly uploaded image in status uploaded.
     */
    public RetinalImage register(Long patientId, Long clinicId, Long uploadedBy,
                                 ImageType imageType, EyeSide eyeSide, String imageUrl) {
        if (patientId == null) {
            throw new ValidationException("Patient id is required");
        }
        if (uploadedBy == null) {
            throw new ValidationException("Uploader id is required");
        }
        if (imageType == null || eyeSide == null) {
            throw new ValidationException("Image type and eye side are required");
        }
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new ValidationException("Image URL is required");
        }

        RetinalImage saved = imageRepository.save(RetinalImage.builder()
            .patientId(patientId)
            .clinicId(clinicId)
            .uploadedBy(uploadedBy)
            .imageType(imageType)
            .eyeSide(eyeSide)
            .imageUrl(imageUrl.trim())
            .uploadTime(LocalDateTime.now(clock))
            .status(ImageStatus.UPLOADED)
            .build());

        log.info("Registered {} image {} ({} eye) for patient {}",
            imageType.getValue(), saved.getId(), eyeSide.getValue(), patientId);
        return saved;
    }

    @Transactional(readOnly = true)
    public RetinalImage getById(Long id) {
        return imageRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Retinal image not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<RetinalImage> findByPatient(Long patientId) {
        return imageRepository.findByPatientIdOrderByUploadTimeDesc(patientId);
    }

    @Transactional(readOnly = true)
    public List<RetinalImage> findByClinic(Long clinicId) {
        return imageRepository.findByClinicIdOrderByUploadTimeDesc(clinicId);
    }

    @Transactional(readOnly = true)
    public List<RetinalImage> findByStatus(ImageStatus status) {
        return imageRepository.findByStatus(status);
    }

    /**
     * Delete an image that has never been analyzed.
     */
    public void delete(Long id) {
        // same row lock as analysis submission, so an analysis committed meanwhile is seen below
        RetinalImage image = imageRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new NotFoundException("Retinal image not found: " + id));
        if (analysisRepository.existsByImageId(id)) {
            throw new ConflictException("Retinal image " + id + " is referenced by an analysis");
        }
        imageRepository.delete(image);
    }
}
