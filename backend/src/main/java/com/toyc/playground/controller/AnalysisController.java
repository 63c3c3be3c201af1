package com.toyc.playground.controller;

import com.toyc.playground.dto.AnalysisRequest;
import com.toyc.playground.dto.AnalysisResult;
import com.toyc.playground.service.ToyCAnalysisService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/analysis")
@Validated
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final ToyCAnalysisService analysisService;

    public AnalysisController(ToyCAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResult> analyze(@Valid @RequestBody AnalysisRequest request) {
        logger.debug("Received analysis request for {} characters", request.sourceCode().length());

        try {
            AnalysisResult result = analysisService.analyze(request.sanitizedSourceCode());

            logger.debug("Analysis request completed: tokens={}, errors={}",
                    result.tokens().size(), result.errors().size());

            return ResponseEntity.ok(result);

        } catch (Exception e) {
            logger.error("Unexpected error during analysis request", e);
            return ResponseEntity.internalServerError()
                    .body(AnalysisResult.failure("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Analysis service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisResult> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(AnalysisResult.failure(errorMessage.toString()));
    }
}
