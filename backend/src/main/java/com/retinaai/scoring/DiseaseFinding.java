package com.retinaai.scoring;

import com.retinaai.model.enums.RiskLevel;

import java.math.BigDecimal;

/**
 * Disease / risk / confidence triple reported by the scorer.
 */
public record DiseaseFinding(
    String diseaseType,
    RiskLevel riskLevel,
    BigDecimal confidence
) {

    public static DiseaseFinding of(String diseaseType, RiskLevel riskLevel, double confidence) {
        return new DiseaseFinding(diseaseType, riskLevel, BigDecimal.valueOf(confidence));
    }
}
