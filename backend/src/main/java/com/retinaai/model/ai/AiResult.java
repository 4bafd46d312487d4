package com.retinaai.model.ai;

import com.retinaai.model.enums.RiskLevel;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * A single disease finding produced by the scorer for an analysis.
 */
@Entity
@Table(name = "ai_result", indexes = {
    @Index(name = "idx_result_analysis", columnList = "analysis_id"),
    @Index(name = "idx_result_risk", columnList = "risk_level")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "analysis_id", nullable = false)
    private AiAnalysis analysis;

    @Column(name = "disease_type", nullable = false, length = 100)
    private String diseaseType;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 20)
    private RiskLevel riskLevel;

    @Column(name = "confidence_score", nullable = false, precision = 5, scale = 2)
    private BigDecimal confidenceScore;
}
