package com.retinaai.model.ai;

import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.imaging.RetinalImage;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One AI scoring run over a retinal image with a specific model version.
 * Central state object of the pipeline.
 */
@Entity
@Table(name = "ai_analysis", indexes = {
    @Index(name = "idx_analysis_image", columnList = "image_id"),
    @Index(name = "idx_analysis_status", columnList = "status"),
    @Index(name = "idx_analysis_time", columnList = "analysis_time")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "image_id", nullable = false)
    private RetinalImage image;

    @ManyToOne(optional = false)
    @JoinColumn(name = "ai_model_version_id", nullable = false)
    private AiModelVersion modelVersion;

    @Column(name = "analysis_time", nullable = false)
    private LocalDateTime analysisTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AnalysisStatus status;

    /**
     * Elapsed milliseconds between start and completion. Null until completed.
     */
    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @OneToMany(mappedBy = "analysis", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @Builder.Default
    private List<AiResult> results = new ArrayList<>();

    @OneToOne(mappedBy = "analysis", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private AiAnnotation annotation;

    /**
     * Helper method to add a result.
     */
    public void addResult(AiResult result) {
        results.add(result);
        result.setAnalysis(this);
    }

    /**
     * Helper method to attach the annotation.
     */
    public void attachAnnotation(AiAnnotation annotation) {
        this.annotation = annotation;
        annotation.setAnalysis(this);
    }
}
