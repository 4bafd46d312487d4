package com.retinaai.model.medical;

import com.retinaai.model.ai.AiAnalysis;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Finalized report for an approved analysis. One per analysis.
 */
@Entity
@Table(name = "medical_report", indexes = {
    @Index(name = "idx_report_patient", columnList = "patient_id"),
    @Index(name = "idx_report_doctor", columnList = "doctor_id"),
    @Index(name = "idx_report_created", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicalReport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "analysis_id", nullable = false, unique = true)
    private AiAnalysis analysis;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "doctor_id", nullable = false)
    private Long doctorId;

    @Column(name = "report_url", nullable = false, length = 500)
    private String reportUrl;

    /**
     * Advisory and preventive text for the overall risk at generation time.
     */
    @Column(columnDefinition = "TEXT")
    private String recommendation;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
