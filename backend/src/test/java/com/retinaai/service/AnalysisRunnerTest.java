package com.retinaai.service;

import com.retinaai.PipelineTestSupport;
import com.retinaai.exception.ExternalServiceException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.enums.ImageStatus;
import com.retinaai.model.enums.RiskLevel;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.scoring.DiseaseFinding;
import com.retinaai.scoring.RetinalScorer;
import com.retinaai.scoring.ScoringOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest
class AnalysisRunnerTest extends PipelineTestSupport {

    @Autowired
    private AnalysisRunner runner;

    @MockBean
    private RetinalScorer scorer;

    @Test
    void successfulScoreCompletesAnalysis() {
        registerActiveModel("v2.0");
        RetinalImage image = uploadImage();
        when(scorer.score(eq(image.getImageUrl()), anyString())).thenReturn(new ScoringOutcome(
            List.of(DiseaseFinding.of("diabetic_retinopathy", RiskLevel.HIGH, 0.93)),
            "https://heatmaps.test/1.png",
            "microaneurysms"));

        AiAnalysis analysis = runner.run(image.getId());

        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(imageService.getById(image.getId()).getStatus()).isEqualTo(ImageStatus.ANALYZED);
        assertThat(resultRepository.countByAnalysisId(analysis.getId())).isEqualTo(1);
        assertThat(annotationRepository.findByAnalysisId(analysis.getId()))
            .hasValueSatisfying(a -> assertThat(a.getDescription()).isEqualTo("microaneurysms"));
    }

    @Test
    void scorerErrorFailsAnalysisWithItsMessage() {
        registerActiveModel("v1.0");
        RetinalImage image = uploadImage();
        when(scorer.score(anyString(), anyString()))
            .thenThrow(new ExternalServiceException("Scorer call failed: 503 Service Unavailable"));

        AiAnalysis analysis = runner.run(image.getId());

        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(analysis.getFailureReason()).isEqualTo("Scorer call failed: 503 Service Unavailable");
        assertThat(imageService.getById(image.getId()).getStatus()).isEqualTo(ImageStatus.ERROR);
    }

    @Test
    void scorerCrashWithoutMessageIsNamedByType() {
        registerActiveModel("v1.0");
        RetinalImage image = uploadImage();
        when(scorer.score(anyString(), anyString())).thenThrow(new IllegalStateException());

        AiAnalysis analysis = runner.run(image.getId());

        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(analysis.getFailureReason()).isEqualTo("Scorer failed: IllegalStateException");
    }

    @Test
    void slowScorerTimesOut() {
        registerActiveModel("v1.0");
        RetinalImage image = uploadImage();
        when(scorer.score(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new ScoringOutcome(List.of(), "https://heatmaps.test/late.png", null);
        });

        AiAnalysis analysis = runner.run(image.getId(), Duration.ofMillis(200));

        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(analysis.getFailureReason()).isEqualTo(AnalysisRunner.TIMEOUT_REASON);
    }

    @Test
    void invalidScorerOutputFailsAnalysis() {
        registerActiveModel("v1.0");
        RetinalImage image = uploadImage();
        when(scorer.score(anyString(), anyString())).thenReturn(new ScoringOutcome(
            List.of(DiseaseFinding.of("amd", RiskLevel.MEDIUM, 1.7)), "https://heatmaps.test/1.png", null));

        AiAnalysis analysis = runner.run(image.getId());

        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(analysis.getFailureReason()).startsWith("Invalid scorer output:");
        assertThat(resultRepository.countByAnalysisId(analysis.getId())).isZero();
    }

    @Test
    void failedRunCanBeRetried() {
        registerActiveModel("v1.0");
        RetinalImage image = uploadImage();
        when(scorer.score(anyString(), anyString()))
            .thenThrow(new ExternalServiceException("connection refused"))
            .thenReturn(new ScoringOutcome(List.of(), "https://heatmaps.test/retry.png", null));

        AiAnalysis first = runner.run(image.getId());
        AiAnalysis second = runner.run(image.getId());

        assertThat(first.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(second.getStatus()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(imageService.getById(image.getId()).getStatus()).isEqualTo(ImageStatus.ANALYZED);
    }

    @Test
    void nonPositiveTimeoutIsRejectedBeforeSubmitting() {
        RetinalImage image = uploadImage();

        assertThatThrownBy(() -> runner.run(image.getId(), Duration.ZERO)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(scorer);
        assertThat(analysisRepository.count()).isZero();
    }
}
