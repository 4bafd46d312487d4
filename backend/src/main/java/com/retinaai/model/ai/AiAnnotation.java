package com.retinaai.model.ai;

import jakarta.persistence.*;
import lombok.*;

/**
 * Visual explanation (heatmap) of an analysis. Exactly one per completed analysis.
 */
@Entity
@Table(name = "ai_annotation")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiAnnotation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "analysis_id", nullable = false, unique = true)
    private AiAnalysis analysis;

    @Column(name = "heatmap_url", nullable = false, length = 500)
    private String heatmapUrl;

    @Column(length = 1000)
    private String description;
}
