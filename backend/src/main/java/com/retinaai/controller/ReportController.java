package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.request.UpdateReportUrlRequest;
import com.retinaai.dto.response.ReportDto;
import com.retinaai.model.medical.MedicalReport;
import com.retinaai.service.MedicalReportService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for medical reports.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final MedicalReportService reportService;
    private final PipelineMapper mapper;

    public ReportController(MedicalReportService reportService, PipelineMapper mapper) {
        this.reportService = reportService;
        this.mapper = mapper;
    }

    /**
     * Generate the report of an approved analysis. Repeated calls return the same report.
     */
    @PostMapping("/analyses/{analysisId}")
    public ResponseEntity<ReportDto> generate(@PathVariable Long analysisId) {
        return ResponseEntity.ok(mapper.toDto(reportService.generate(analysisId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReportDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(reportService.getById(id)));
    }

    @GetMapping("/analyses/{analysisId}")
    public ResponseEntity<ReportDto> getByAnalysis(@PathVariable Long analysisId) {
        return reportService.findByAnalysis(analysisId)
            .map(mapper::toDto)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/patients/{patientId}")
    public ResponseEntity<List<ReportDto>> getByPatient(
            @PathVariable Long patientId,
            @RequestParam(required = false) Integer limit) {
        List<MedicalReport> reports = limit != null
            ? reportService.findRecentByPatient(patientId, limit)
            : reportService.findByPatient(patientId);
        return ResponseEntity.ok(reports.stream().map(mapper::toDto).toList());
    }

    @GetMapping("/doctors/{doctorId}")
    public ResponseEntity<List<ReportDto>> getByDoctor(@PathVariable Long doctorId) {
        return ResponseEntity.ok(reportService.findByDoctor(doctorId).stream().map(mapper::toDto).toList());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ReportDto> updateUrl(@PathVariable Long id, @Valid @RequestBody UpdateReportUrlRequest request) {
        return ResponseEntity.ok(mapper.toDto(reportService.updateReportUrl(id, request.reportUrl())));
    }
}
