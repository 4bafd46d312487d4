package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.request.AmendReviewRequest;
import com.retinaai.dto.request.SubmitReviewRequest;
import com.retinaai.dto.response.ReviewDto;
import com.retinaai.dto.response.ReviewStatsDto;
import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.medical.DoctorReview;
import com.retinaai.model.medical.ReviewAmendment;
import com.retinaai.service.DoctorReviewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for doctor reviews.
 */
@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final DoctorReviewService reviewService;
    private final PipelineMapper mapper;

    public ReviewController(DoctorReviewService reviewService, PipelineMapper mapper) {
        this.reviewService = reviewService;
        this.mapper = mapper;
    }

    @PostMapping
    public ResponseEntity<ReviewDto> submit(@Valid @RequestBody SubmitReviewRequest request) {
        DoctorReview review = reviewService.submitReview(
            request.analysisId(),
            request.doctorId(),
            mapper.parse(request.decision(), ValidationStatus::fromValue, "decision"),
            request.comment());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(review));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ReviewDto> amend(@PathVariable Long id, @Valid @RequestBody AmendReviewRequest request) {
        DoctorReview review = reviewService.amendReview(id, new ReviewAmendment(
            mapper.parse(request.decision(), ValidationStatus::fromValue, "decision"),
            request.comment()));
        return ResponseEntity.ok(mapper.toDto(review));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReviewDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(reviewService.getById(id)));
    }

    @GetMapping("/analyses/{analysisId}")
    public ResponseEntity<ReviewDto> getByAnalysis(@PathVariable Long analysisId) {
        return reviewService.findByAnalysis(analysisId)
            .map(mapper::toDto)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/doctors/{doctorId}")
    public ResponseEntity<List<ReviewDto>> getByDoctor(@PathVariable Long doctorId) {
        return ResponseEntity.ok(reviewService.findByDoctor(doctorId).stream().map(mapper::toDto).toList());
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ReviewDto>> getPending() {
        return ResponseEntity.ok(reviewService.findPending().stream().map(mapper::toDto).toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<ReviewStatsDto> getStats() {
        return ResponseEntity.ok(mapper.toDto(reviewService.getStatistics()));
    }
}
