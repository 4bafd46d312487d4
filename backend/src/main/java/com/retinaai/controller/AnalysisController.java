package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.request.CompleteAnalysisRequest;
import com.retinaai.dto.request.FailAnalysisRequest;
import com.retinaai.dto.response.AnalysisDetailDto;
import com.retinaai.dto.response.AnalysisDto;
import com.retinaai.dto.response.AnalysisStatsDto;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.service.AnalysisOrchestrator;
import com.retinaai.service.AnalysisResultService;
import com.retinaai.service.AnalysisRunner;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for the analysis pipeline.
 *
 * POST /images/{imageId}/run drives the scorer synchronously. The submit,
 * complete and fail endpoints expose the individual transitions for scorers
 * that report back asynchronously.
 */
@RestController
@RequestMapping("/api/analyses")
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;
    private final AnalysisRunner runner;
    private final AnalysisResultService resultService;
    private final PipelineMapper mapper;

    public AnalysisController(
            AnalysisOrchestrator orchestrator,
            AnalysisRunner runner,
            AnalysisResultService resultService,
            PipelineMapper mapper) {
        this.orchestrator = orchestrator;
        this.runner = runner;
        this.resultService = resultService;
        this.mapper = mapper;
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    @PostMapping("/images/{imageId}/run")
    public ResponseEntity<AnalysisDto> run(@PathVariable Long imageId) {
        return ResponseEntity.ok(mapper.toDto(runner.run(imageId)));
    }

    @PostMapping("/images/{imageId}")
    public ResponseEntity<AnalysisDto> submit(@PathVariable Long imageId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(orchestrator.submit(imageId)));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<AnalysisDto> complete(@PathVariable Long id,
                                                @Valid @RequestBody CompleteAnalysisRequest request) {
        AiAnalysis analysis = orchestrator.complete(id,
            mapper.toFindings(request.findings()), request.heatmapUrl(), request.description());
        return ResponseEntity.ok(mapper.toDto(analysis));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<AnalysisDto> fail(@PathVariable Long id,
                                            @Valid @RequestBody FailAnalysisRequest request) {
        return ResponseEntity.ok(mapper.toDto(orchestrator.fail(id, request.reason())));
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    @GetMapping("/{id}")
    public ResponseEntity<AnalysisDetailDto> get(@PathVariable Long id) {
        AiAnalysis analysis = orchestrator.getById(id);
        return ResponseEntity.ok(mapper.toDetailDto(
            analysis,
            resultService.getResults(id),
            resultService.findAnnotation(id).orElse(null)));
    }

    @GetMapping("/images/{imageId}/current")
    public ResponseEntity<AnalysisDto> getCurrentForImage(@PathVariable Long imageId) {
        return orchestrator.findCurrentByImage(imageId)
            .map(mapper::toDto)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<AnalysisDto>> list(@RequestParam String status) {
        List<AiAnalysis> analyses = orchestrator.findByStatus(
            mapper.parse(status, AnalysisStatus::fromValue, "analysis status"));
        return ResponseEntity.ok(analyses.stream().map(mapper::toDto).toList());
    }

    @GetMapping("/patients/{patientId}")
    public ResponseEntity<List<AnalysisDto>> patientHistory(
            @PathVariable Long patientId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        List<AiAnalysis> history = orchestrator.findPatientHistory(patientId, page, size, startDate, endDate);
        return ResponseEntity.ok(history.stream().map(mapper::toDto).toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<AnalysisStatsDto> getStats() {
        return ResponseEntity.ok(mapper.toDto(orchestrator.getStatistics()));
    }
}
