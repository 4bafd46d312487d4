package com.retinaai.model.ai;

import com.retinaai.model.enums.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskSummaryTest {

    @Test
    void emptyResultsSummarizeAsLowWithoutFindings() {
        RiskSummary summary = RiskSummary.of(List.of());

        assertThat(summary.highestRisk()).isEqualTo(RiskLevel.LOW);
        assertThat(summary.hasFindings()).isFalse();
        assertThat(summary.diseaseTypes()).isEmpty();
        assertThat(summary.confidence()).isNull();
        assertThat(summary.diseaseLabel()).isNull();
        assertThat(summary.describe()).isEqualTo("no findings");
    }

    @Test
    void highestLevelWinsRegardlessOfOrder() {
        RiskSummary summary = RiskSummary.of(List.of(
            result("amd", RiskLevel.MEDIUM, "0.97"),
            result("diabetic_retinopathy", RiskLevel.HIGH, "0.81"),
            result("normal", RiskLevel.LOW, "0.99")));

        assertThat(summary.highestRisk()).isEqualTo(RiskLevel.HIGH);
        assertThat(summary.diseaseTypes()).containsExactly("diabetic_retinopathy");
        assertThat(summary.confidence()).isEqualByComparingTo("0.81");
        assertThat(summary.findingCount()).isEqualTo(3);
        assertThat(summary.describe()).isEqualTo("high (diabetic_retinopathy)");
    }

    @Test
    void tiesAtTheTopKeepEveryDiseaseAndTheBestConfidence() {
        RiskSummary summary = RiskSummary.of(List.of(
            result("glaucoma", RiskLevel.HIGH, "0.70"),
            result("amd", RiskLevel.LOW, "0.99"),
            result("diabetic_retinopathy", RiskLevel.HIGH, "0.88"),
            result("glaucoma", RiskLevel.HIGH, "0.65")));

        assertThat(summary.diseaseTypes()).containsExactly("glaucoma", "diabetic_retinopathy");
        assertThat(summary.diseaseLabel()).isEqualTo("glaucoma, diabetic_retinopathy");
        assertThat(summary.confidence()).isEqualByComparingTo("0.88");
    }

    @Test
    void criticalOutranksHigh() {
        RiskSummary summary = RiskSummary.of(List.of(
            result("diabetic_retinopathy", RiskLevel.HIGH, "0.95"),
            result("retinal_detachment", RiskLevel.CRITICAL, "0.55")));

        assertThat(summary.highestRisk()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(summary.diseaseTypes()).containsExactly("retinal_detachment");
    }

    private static AiResult result(String disease, RiskLevel level, String confidence) {
        return AiResult.builder()
            .diseaseType(disease)
            .riskLevel(level)
            .confidenceScore(new BigDecimal(confidence))
            .build();
    }
}
