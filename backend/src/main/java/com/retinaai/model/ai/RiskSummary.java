package com.retinaai.model.ai;

import com.retinaai.model.enums.RiskLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Overall risk of an analysis as seen by review and notification consumers.
 *
 * The overall level is the maximum risk over all results. Every disease type at
 * that level is kept. An analysis without findings summarizes as low.
 *
 * @param highestRisk   maximum risk level across results
 * @param diseaseTypes  disease types at {@code highestRisk}, in result order
 * @param confidence    highest confidence among those results, null without findings
 * @param findingCount  total number of results
 */
public record RiskSummary(
    RiskLevel highestRisk,
    List<String> diseaseTypes,
    BigDecimal confidence,
    int findingCount
) {

    public static RiskSummary of(Collection<AiResult> results) {
        if (results == null || results.isEmpty()) {
            return new RiskSummary(RiskLevel.LOW, List.of(), null, 0);
        }

        RiskLevel highest = RiskLevel.LOW;
        for (AiResult result : results) {
            highest = RiskLevel.max(highest, result.getRiskLevel());
        }

        List<String> diseases = new ArrayList<>();
        BigDecimal confidence = null;
        for (AiResult result : results) {
            if (result.getRiskLevel() != highest) {
                continue;
            }
            if (!diseases.contains(result.getDiseaseType())) {
                diseases.add(result.getDiseaseType());
            }
            if (confidence == null || result.getConfidenceScore().compareTo(confidence) > 0) {
                confidence = result.getConfidenceScore();
            }
        }
        return new RiskSummary(highest, List.copyOf(diseases), confidence, results.size());
    }

    public boolean hasFindings() {
        return findingCount > 0;
    }

    /**
     * Comma-separated disease types at the highest level, or null when there are none.
     */
    public String diseaseLabel() {
        return diseaseTypes.isEmpty() ? null : String.join(", ", diseaseTypes);
    }

    /**
     * Short human-readable form, e.g. {@code high (diabetic_retinopathy)}.
     */
    public String describe() {
        if (!hasFindings()) {
            return "no findings";
        }
        return highestRisk.getValue() + " (" + diseaseLabel() + ")";
    }
}
