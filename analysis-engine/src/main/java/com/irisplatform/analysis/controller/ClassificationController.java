package com.irisplatform.analysis.controller;

import com.irisplatform.analysis.dto.ClassificationRequest;
import com.irisplatform.analysis.dto.ClassificationResponseDTO;
import com.irisplatform.analysis.dto.RubricDTO;
import com.irisplatform.analysis.dto.SampleClassificationRequest;
import com.irisplatform.analysis.service.ClassificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/classification")
public class ClassificationController {

    private final ClassificationService classificationService;

    public ClassificationController(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @PostMapping
    public Mono<ResponseEntity<ClassificationResponseDTO>> classify(@RequestBody ClassificationRequest request) {
        return classificationService.classify(request).map(ResponseEntity::ok);
    }

    @PostMapping("/samples")
    public Mono<ResponseEntity<ClassificationResponseDTO>> classifySamples(
            @RequestBody SampleClassificationRequest request) {
        return classificationService.classifySamples(request).map(ResponseEntity::ok);
    }

    @GetMapping("/rubric")
    public ResponseEntity<RubricDTO> rubric() {
        return ResponseEntity.ok(classificationService.rubric());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
