package com.retinaai.model.imaging;

import com.retinaai.model.enums.EyeSide;
import com.retinaai.model.enums.ImageStatus;
import com.retinaai.model.enums.ImageType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Uploaded retinal image awaiting or carrying an AI analysis.
 * Status is only changed by the analysis orchestrator.
 */
@Entity
@Table(name = "retinal_image", indexes = {
    @Index(name = "idx_image_patient", columnList = "patient_id"),
    @Index(name = "idx_image_clinic", columnList = "clinic_id"),
    @Index(name = "idx_image_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetinalImage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "clinic_id")
    private Long clinicId;

    @Column(name = "uploaded_by", nullable = false)
    private Long uploadedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "image_type", nullable = false, length = 20)
    private ImageType imageType;

    @Enumerated(EnumType.STRING)
    @Column(name = "eye_side", nullable = false, length = 10)
    private EyeSide eyeSide;

    @Column(name = "image_url", nullable = false, length = 500)
    private String imageUrl;

    @Column(name = "upload_time", nullable = false)
    private LocalDateTime uploadTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ImageStatus status;
}
