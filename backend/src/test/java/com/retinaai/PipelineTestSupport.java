package com.retinaai;

import com.retinaai.model.ai.AiModelVersion;
import com.retinaai.model.enums.EyeSide;
import com.retinaai.model.enums.ImageType;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.repository.*;
import com.retinaai.service.ModelRegistryService;
import com.retinaai.service.RetinalImageService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Shared fixture for tests running against the full application context.
 * Tests commit for real so that after-commit listeners fire; the database is
 * emptied before each test instead of rolled back after it.
 */
public abstract class PipelineTestSupport {

    protected static final Long PATIENT_ID = 501L;
    protected static final Long CLINIC_ID = 77L;
    protected static final Long UPLOADER_ID = 9L;
    protected static final Long DOCTOR_ID = 42L;

    @Autowired protected ModelRegistryService registryService;
    @Autowired protected RetinalImageService imageService;

    @Autowired protected NotificationRepository notificationRepository;
    @Autowired protected MedicalReportRepository reportRepository;
    @Autowired protected DoctorReviewRepository reviewRepository;
    @Autowired protected AiAnnotationRepository annotationRepository;
    @Autowired protected AiResultRepository resultRepository;
    @Autowired protected AiAnalysisRepository analysisRepository;
    @Autowired protected RetinalImageRepository imageRepository;
    @Autowired protected AiModelVersionRepository modelVersionRepository;

    @BeforeEach
    void cleanDatabase() {
        notificationRepository.deleteAllInBatch();
        reportRepository.deleteAllInBatch();
        reviewRepository.deleteAllInBatch();
        annotationRepository.deleteAllInBatch();
        resultRepository.deleteAllInBatch();
        analysisRepository.deleteAllInBatch();
        imageRepository.deleteAllInBatch();
        modelVersionRepository.deleteAllInBatch();
    }

    protected AiModelVersion registerActiveModel(String version) {
        AiModelVersion model = registryService.register("retina-net", version, "{\"dr\":0.5,\"amd\":0.6}");
        return model.isActive() ? model : registryService.activate(model.getId());
    }

    protected RetinalImage uploadImage() {
        return uploadImage(PATIENT_ID);
    }

    protected RetinalImage uploadImage(Long patientId) {
        return imageService.register(patientId, CLINIC_ID, UPLOADER_ID,
            ImageType.FUNDUS, EyeSide.LEFT, "https://images.test/fundus-" + patientId + ".png");
    }
}
