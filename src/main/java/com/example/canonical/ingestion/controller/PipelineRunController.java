package com.example.canonical.ingestion.controller;

import com.example.canonical.ingestion.model.RunStatusResponse;
import com.example.canonical.ingestion.service.PipelineRunService;
import com.example.canonical.ingestion.support.FileProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PipelineRunController {

    private final PipelineRunService pipelineRunService;

    @PostMapping("/pipeline-runs")
    public ResponseEntity<RunStatusResponse> start() {
        RunStatusResponse run = pipelineRunService.enqueue();
        log.info("Accepted pipeline run={}", run.runId());

        return ResponseEntity.accepted()
            .location(ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{runId}")
                .buildAndExpand(run.runId())
                .toUri())
            .body(run);
    }

    @GetMapping("/pipeline-runs/{runId}")
    public ResponseEntity<RunStatusResponse> getStatus(@PathVariable String runId) {
        return pipelineRunService.find(runId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<String> handleFileProcessingException(FileProcessingException exception) {
        log.warn("Pipeline request rejected: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(exception.getMessage());
    }
}
