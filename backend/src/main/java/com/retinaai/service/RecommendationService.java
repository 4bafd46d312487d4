package com.retinaai.service;

import com.retinaai.exception.ValidationException;
import com.retinaai.model.enums.RiskLevel;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recommendation Service
 *
 * Maps a risk level (and confidence) to advisory text shown to patients and
 * stored on reports. Deterministic and side-effect free; never gates a state change.
 *
 * Critical has its own advisory and preventive text. For warnings it is treated as high.
 */
@Service
public class RecommendationService {

    private static final BigDecimal URGENT_CONFIDENCE = new BigDecimal("0.90");
    private static final BigDecimal UNCERTAIN_HIGH_RISK_CONFIDENCE = new BigDecimal("0.60");
    private static final BigDecimal LOW_CONFIDENCE = new BigDecimal("0.50");
    private static final BigDecimal REMINDER_CONFIDENCE = new BigDecimal("0.80");

    /**
     * Advisory text for a risk level.
     */
    public String advise(RiskLevel riskLevel) {
        return advise(riskLevel, null);
    }

    /**
     * Advisory text for a risk level, with a disease note appended when a
     * non-normal disease type is given.
     */
    public String advise(RiskLevel riskLevel, String diseaseType) {
        String advice = switch (requireLevel(riskLevel)) {
            case CRITICAL -> "CRITICAL RISK DETECTED: Urgent ophthalmologic care is required. "
                + "Please contact your doctor or an eye emergency service today.";
            case HIGH -> "HIGH RISK DETECTED: Immediate consultation with an ophthalmologist "
                + "is strongly recommended. Please schedule an appointment as soon as possible "
                + "for further evaluation and treatment planning.";
            case MEDIUM -> "MODERATE RISK: Regular monitoring is advised. Please schedule a "
                + "follow-up appointment within 1-2 months to track any changes in your condition.";
            case LOW -> "LOW RISK: Continue with regular eye checkups as recommended by your "
                + "healthcare provider. Maintain a healthy lifestyle and monitor any changes in vision.";
        };

        if (diseaseType != null && !diseaseType.isBlank() && !"normal".equalsIgnoreCase(diseaseType.trim())) {
            advice += "\n\nDisease detected: " + diseaseType.trim() + ". Please discuss this with your doctor.";
        }
        return advice;
    }

    /**
     * Warnings for a risk level at a given confidence in [0, 1]. May be empty.
     */
    public List<String> warn(RiskLevel riskLevel, BigDecimal confidence) {
        RiskLevel level = requireLevel(riskLevel);
        if (confidence == null || confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("Confidence must be between 0 and 1, got: " + confidence);
        }
        boolean highRisk = level.isAtLeast(RiskLevel.HIGH);

        List<String> warnings = new ArrayList<>();
        if (highRisk && confidence.compareTo(URGENT_CONFIDENCE) > 0) {
            warnings.add("URGENT: High confidence high-risk detection. Immediate medical attention recommended.");
        }
        if (highRisk && confidence.compareTo(UNCERTAIN_HIGH_RISK_CONFIDENCE) < 0) {
            warnings.add("CAUTION: High risk detected but with lower confidence. "
                + "Manual review by doctor is strongly recommended.");
        }
        if (confidence.compareTo(LOW_CONFIDENCE) < 0) {
            warnings.add("NOTE: Low confidence score. Manual review by healthcare professional is recommended.");
        }
        if (level == RiskLevel.MEDIUM && confidence.compareTo(REMINDER_CONFIDENCE) > 0) {
            warnings.add("REMINDER: Moderate risk detected. Regular follow-up appointments are important.");
        }
        return List.copyOf(warnings);
    }

    /**
     * Preventive advice for a risk level.
     */
    public String prevent(RiskLevel riskLevel) {
        return switch (requireLevel(riskLevel)) {
            case CRITICAL -> """
                Preventive Measures:
                - Seek specialist care before any other change in treatment
                - Avoid driving and strenuous activity until examined
                - Keep blood sugar and blood pressure under close control
                - Bring your current medication list to the appointment
                - Follow your doctor's treatment plan strictly""";
            case HIGH -> """
                Preventive Measures:
                - Avoid smoking and limit alcohol consumption
                - Control blood sugar and blood pressure if diabetic/hypertensive
                - Protect eyes from UV radiation with sunglasses
                - Maintain a healthy diet rich in antioxidants
                - Follow your doctor's treatment plan strictly""";
            case MEDIUM -> """
                Preventive Measures:
                - Regular eye examinations every 6-12 months
                - Monitor blood sugar and blood pressure
                - Maintain healthy lifestyle habits
                - Report any vision changes immediately""";
            case LOW -> """
                Preventive Measures:
                - Continue regular eye checkups annually
                - Maintain healthy lifestyle
                - Protect eyes from UV radiation
                - Stay hydrated and eat a balanced diet""";
        };
    }

    private RiskLevel requireLevel(RiskLevel riskLevel) {
        if (riskLevel == null) {
            throw new ValidationException("Risk level is required");
        }
        return riskLevel;
    }
}
