package com.retinaai.model.ai;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A trained AI model version. At most one version is active at a time.
 */
@Entity
@Table(name = "ai_model_version",
    uniqueConstraints = @UniqueConstraint(name = "uk_model_name_version", columnNames = {"model_name", "version"}),
    indexes = @Index(name = "idx_model_active", columnList = "active"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Column(nullable = false, length = 50)
    private String version;

    /**
     * Threshold configuration handed to the scorer as-is.
     */
    @Column(name = "threshold_config", nullable = false, length = 1000)
    private String thresholdConfig;

    @Column(name = "trained_at", nullable = false)
    private LocalDateTime trainedAt;

    @Column(nullable = false)
    private boolean active;
}
