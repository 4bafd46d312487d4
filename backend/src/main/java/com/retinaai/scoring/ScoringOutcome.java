package com.retinaai.scoring;

import java.util.List;

/**
 * Successful scorer answer: zero or more findings plus the heatmap explaining them.
 */
public record ScoringOutcome(
    List<DiseaseFinding> findings,
    String heatmapUrl,
    String description
) {

    public ScoringOutcome {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
