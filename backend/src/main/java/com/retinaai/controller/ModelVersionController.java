package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.request.RegisterModelVersionRequest;
import com.retinaai.dto.request.UpdateModelVersionRequest;
import com.retinaai.dto.response.ModelVersionDto;
import com.retinaai.model.ai.AiModelVersion;
import com.retinaai.model.ai.ModelVersionUpdate;
import com.retinaai.service.ModelRegistryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the AI model registry.
 */
@RestController
@RequestMapping("/api/model-versions")
public class ModelVersionController {

    private final ModelRegistryService registryService;
    private final PipelineMapper mapper;

    public ModelVersionController(ModelRegistryService registryService, PipelineMapper mapper) {
        this.registryService = registryService;
        this.mapper = mapper;
    }

    @GetMapping
    public ResponseEntity<List<ModelVersionDto>> getAll(@RequestParam(required = false) String version) {
        List<AiModelVersion> versions = version != null && !version.isBlank()
            ? registryService.findByVersion(version)
            : registryService.findAll();
        return ResponseEntity.ok(versions.stream().map(mapper::toDto).toList());
    }

    @GetMapping("/active")
    public ResponseEntity<ModelVersionDto> getActive() {
        return ResponseEntity.ok(mapper.toDto(registryService.getActive()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ModelVersionDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(registryService.getById(id)));
    }

    @PostMapping
    public ResponseEntity<ModelVersionDto> register(@Valid @RequestBody RegisterModelVersionRequest request) {
        AiModelVersion created = registryService.register(
            request.modelName(), request.version(), request.thresholdConfig());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(created));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<ModelVersionDto> activate(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(registryService.activate(id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ModelVersionDto> update(@PathVariable Long id,
                                                  @Valid @RequestBody UpdateModelVersionRequest request) {
        AiModelVersion updated = registryService.update(id,
            new ModelVersionUpdate(request.modelName(), request.thresholdConfig()));
        return ResponseEntity.ok(mapper.toDto(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        registryService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
