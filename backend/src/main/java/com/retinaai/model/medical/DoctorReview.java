package com.retinaai.model.medical;

import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.ValidationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Doctor verdict on a completed analysis. One per analysis.
 */
@Entity
@Table(name = "doctor_review", indexes = {
    @Index(name = "idx_review_doctor", columnList = "doctor_id"),
    @Index(name = "idx_review_status", columnList = "validation_status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorReview {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "analysis_id", nullable = false, unique = true)
    private AiAnalysis analysis;

    @Column(name = "doctor_id", nullable = false)
    private Long doctorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 20)
    private ValidationStatus validationStatus;

    @Column(length = 1000)
    private String comment;

    @Column(name = "reviewed_at", nullable = false)
    private LocalDateTime reviewedAt;
}
