package com.retinaai.service;

import com.retinaai.PipelineTestSupport;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.PreconditionException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.NotificationType;
import com.retinaai.model.enums.RiskLevel;
import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.medical.MedicalReport;
import com.retinaai.model.notification.Notification;
import com.retinaai.scoring.DiseaseFinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class MedicalReportServiceTest extends PipelineTestSupport {

    @Autowired
    private MedicalReportService reportService;

    @Autowired
    private DoctorReviewService reviewService;

    @Autowired
    private AnalysisOrchestrator orchestrator;

    @Autowired
    private RecommendationService recommendationService;

    @Autowired
    private NotificationService notificationService;

    @BeforeEach
    void setUpModel() {
        registerActiveModel("v1.0");
    }

    @Test
    void approvedAnalysisProducesReport() {
        AiAnalysis analysis = approvedAnalysis();

        MedicalReport report = reportService.generate(analysis.getId());

        assertThat(report.getPatientId()).isEqualTo(PATIENT_ID);
        assertThat(report.getDoctorId()).isEqualTo(DOCTOR_ID);
        assertThat(report.getReportUrl()).isEqualTo("https://reports.test/reports/analysis-" + analysis.getId() + ".pdf");
        assertThat(report.getRecommendation())
            .isEqualTo(recommendationService.advise(RiskLevel.HIGH, "diabetic_retinopathy")
                + "\n\n" + recommendationService.prevent(RiskLevel.HIGH));
        assertThat(report.getCreatedAt()).isNotNull();
    }

    @Test
    void generateIsIdempotent() {
        AiAnalysis analysis = approvedAnalysis();

        MedicalReport first = reportService.generate(analysis.getId());
        MedicalReport second = reportService.generate(analysis.getId());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(reportRepository.count()).isEqualTo(1);
        assertThat(notificationService.findByAccount(PATIENT_ID))
            .filteredOn(n -> n.getType() == NotificationType.REPORT_READY)
            .hasSize(1);
    }

    @Test
    void reportNotificationCarriesUrl() {
        AiAnalysis analysis = approvedAnalysis();

        MedicalReport report = reportService.generate(analysis.getId());

        List<Notification> ready = notificationService.findByAccount(PATIENT_ID).stream()
            .filter(n -> n.getType() == NotificationType.REPORT_READY)
            .toList();
        assertThat(ready).hasSize(1);
        assertThat(ready.get(0).getContent()).contains(report.getReportUrl());
    }

    @Test
    void concurrentGenerateReturnsTheSameReportToEveryCaller() throws Exception {
        AiAnalysis analysis = approvedAnalysis();

        int callers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> reportIds = new ArrayList<>();
        try {
            List<Future<MedicalReport>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return reportService.generate(analysis.getId());
                }));
            }
            start.countDown();
            for (Future<MedicalReport> future : futures) {
                reportIds.add(future.get(30, TimeUnit.SECONDS).getId());
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(reportRepository.count()).isEqualTo(1);
        assertThat(reportIds).hasSize(callers)
            .containsOnly(reportService.findByAnalysis(analysis.getId()).orElseThrow().getId());
        assertThat(notificationService.findByAccount(PATIENT_ID))
            .filteredOn(n -> n.getType() == NotificationType.REPORT_READY)
            .hasSize(1);
    }

    @Test
    void rejectedAnalysisHasNoReport() {
        AiAnalysis analysis = completedAnalysis();
        reviewService.submitReview(analysis.getId(), DOCTOR_ID, ValidationStatus.REJECTED, "False positive");

        assertThatThrownBy(() -> reportService.generate(analysis.getId())).isInstanceOf(PreconditionException.class);
        assertThat(reportRepository.count()).isZero();
    }

    @Test
    void unreviewedAnalysisHasNoReport() {
        AiAnalysis analysis = completedAnalysis();

        assertThatThrownBy(() -> reportService.generate(analysis.getId())).isInstanceOf(PreconditionException.class);
    }

    @Test
    void pendingReviewIsNotEnough() {
        AiAnalysis analysis = completedAnalysis();
        reviewService.submitReview(analysis.getId(), DOCTOR_ID, ValidationStatus.PENDING, null);

        assertThatThrownBy(() -> reportService.generate(analysis.getId())).isInstanceOf(PreconditionException.class);
    }

    @Test
    void processingAnalysisHasNoReport() {
        AiAnalysis analysis = orchestrator.submit(uploadImage().getId());

        assertThatThrownBy(() -> reportService.generate(analysis.getId())).isInstanceOf(PreconditionException.class);
    }

    @Test
    void unknownAnalysisIsNotFound() {
        assertThatThrownBy(() -> reportService.generate(777L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void recentReportsAreLimited() {
        reportService.generate(approvedAnalysis().getId());
        reportService.generate(approvedAnalysis().getId());
        MedicalReport newest = reportService.generate(approvedAnalysis().getId());

        assertThat(reportService.findByPatient(PATIENT_ID)).hasSize(3);
        assertThat(reportService.findRecentByPatient(PATIENT_ID, 1))
            .extracting(MedicalReport::getId)
            .hasSize(1);
        assertThat(reportService.findByDoctor(DOCTOR_ID)).extracting(MedicalReport::getId).contains(newest.getId());
    }

    @Test
    void reportUrlCanBeReplaced() {
        MedicalReport report = reportService.generate(approvedAnalysis().getId());

        reportService.updateReportUrl(report.getId(), "https://cdn.test/r/1.pdf");

        assertThat(reportService.getById(report.getId()).getReportUrl()).isEqualTo("https://cdn.test/r/1.pdf");
    }

    private AiAnalysis completedAnalysis() {
        AiAnalysis analysis = orchestrator.submit(uploadImage().getId());
        return orchestrator.complete(analysis.getId(),
            List.of(DiseaseFinding.of("diabetic_retinopathy", RiskLevel.HIGH, 0.93)), "https://heatmaps.test/dr.png");
    }

    private AiAnalysis approvedAnalysis() {
        AiAnalysis analysis = completedAnalysis();
        reviewService.submitReview(analysis.getId(), DOCTOR_ID, ValidationStatus.APPROVED, null);
        return analysis;
    }
}
