package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.request.RegisterImageRequest;
import com.retinaai.dto.response.RetinalImageDto;
import com.retinaai.model.enums.EyeSide;
import com.retinaai.model.enums.ImageStatus;
import com.retinaai.model.enums.ImageType;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.service.RetinalImageService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for retinal image intake.
 */
@RestController
@RequestMapping("/api/images")
public class RetinalImageController {

    private final RetinalImageService imageService;
    private final PipelineMapper mapper;

    public RetinalImageController(RetinalImageService imageService, PipelineMapper mapper) {
        this.imageService = imageService;
        this.mapper = mapper;
    }

    @PostMapping
    public ResponseEntity<RetinalImageDto> register(@Valid @RequestBody RegisterImageRequest request) {
        RetinalImage image = imageService.register(
            request.patientId(),
            request.clinicId(),
            request.uploadedBy(),
            mapper.parse(request.imageType(), ImageType::fromValue, "image type"),
            mapper.parse(request.eyeSide(), EyeSide::fromValue, "eye side"),
            request.imageUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(image));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RetinalImageDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(imageService.getById(id)));
    }

    /**
     * List images by patient, clinic or status (first filter given wins).
     */
    @GetMapping
    public ResponseEntity<List<RetinalImageDto>> list(
            @RequestParam(required = false) Long patientId,
            @RequestParam(required = false) Long clinicId,
            @RequestParam(required = false) String status) {

        List<RetinalImage> images;
        if (patientId != null) {
            images = imageService.findByPatient(patientId);
        } else if (clinicId != null) {
            images = imageService.findByClinic(clinicId);
        } else if (status != null && !status.isBlank()) {
            images = imageService.findByStatus(mapper.parse(status, ImageStatus::fromValue, "image status"));
        } else {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(images.stream().map(mapper::toDto).toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        imageService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
