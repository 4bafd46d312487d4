package com.retinaai.service;

import com.retinaai.exception.ValidationException;
import com.retinaai.model.enums.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationServiceTest {

    private final RecommendationService service = new RecommendationService();

    @Test
    void adviceDependsOnRiskLevel() {
        assertThat(service.advise(RiskLevel.HIGH)).startsWith("HIGH RISK DETECTED");
        assertThat(service.advise(RiskLevel.MEDIUM)).startsWith("MODERATE RISK");
        assertThat(service.advise(RiskLevel.LOW)).startsWith("LOW RISK");
        assertThat(service.advise(RiskLevel.CRITICAL)).startsWith("CRITICAL RISK DETECTED");
    }

    @Test
    void diseaseNoteIsAppendedUnlessNormal() {
        assertThat(service.advise(RiskLevel.HIGH, "diabetic_retinopathy"))
            .endsWith("Disease detected: diabetic_retinopathy. Please discuss this with your doctor.");
        assertThat(service.advise(RiskLevel.LOW, "Normal")).isEqualTo(service.advise(RiskLevel.LOW));
        assertThat(service.advise(RiskLevel.LOW, " ")).isEqualTo(service.advise(RiskLevel.LOW));
    }

    @Test
    void adviceIsDeterministic() {
        assertThat(service.advise(RiskLevel.MEDIUM, "amd")).isEqualTo(service.advise(RiskLevel.MEDIUM, "amd"));
        assertThat(service.prevent(RiskLevel.HIGH)).isEqualTo(service.prevent(RiskLevel.HIGH));
    }

    @Test
    void confidentHighRiskIsUrgent() {
        List<String> warnings = service.warn(RiskLevel.HIGH, new BigDecimal("0.93"));

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).startsWith("URGENT");
    }

    @Test
    void uncertainHighRiskAsksForManualReview() {
        List<String> warnings = service.warn(RiskLevel.CRITICAL, new BigDecimal("0.45"));

        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0)).startsWith("CAUTION");
        assertThat(warnings.get(1)).startsWith("NOTE");
    }

    @Test
    void confidentMediumRiskGetsReminder() {
        List<String> warnings = service.warn(RiskLevel.MEDIUM, new BigDecimal("0.85"));

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).startsWith("REMINDER");
        assertThat(service.warn(RiskLevel.MEDIUM, new BigDecimal("0.80"))).isEmpty();
    }

    @Test
    void lowRiskAtNormalConfidenceHasNoWarnings() {
        assertThat(service.warn(RiskLevel.LOW, new BigDecimal("0.75"))).isEmpty();
    }

    @Test
    void thresholdsAreExclusive() {
        assertThat(service.warn(RiskLevel.HIGH, new BigDecimal("0.90"))).isEmpty();
        assertThat(service.warn(RiskLevel.HIGH, new BigDecimal("0.60"))).isEmpty();
        assertThat(service.warn(RiskLevel.LOW, new BigDecimal("0.50"))).isEmpty();
    }

    @Test
    void confidenceOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> service.warn(RiskLevel.LOW, new BigDecimal("1.01")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.warn(RiskLevel.LOW, new BigDecimal("-0.01")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.warn(RiskLevel.LOW, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void missingRiskLevelIsRejected() {
        assertThatThrownBy(() -> service.advise(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.prevent(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void preventiveAdviceListsMeasures() {
        for (RiskLevel level : RiskLevel.values()) {
            assertThat(service.prevent(level)).startsWith("Preventive Measures:").contains("\n- ");
        }
        assertThat(service.prevent(RiskLevel.MEDIUM)).contains("every 6-12 months");
    }
}
