package com.athena.canaryservice.controller;

import com.athena.canaryservice.dto.PredictionRequest;
import com.athena.canaryservice.dto.PredictionResponse;
import com.athena.canaryservice.service.CanaryDeploymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequiredArgsConstructor
@Tag(name = "Prediction", description = "Churn probability scoring routed across stable and canary models")
public class PredictionController {

    private final CanaryDeploymentService canaryService;

    @PostMapping("/predict")
    @Operation(summary = "Score a feature vector; returns probability, model used and latency")
    public CompletableFuture<ResponseEntity<PredictionResponse>> predict(@Valid @RequestBody PredictionRequest request) {
        return canaryService.predictAsync(request.getFeatures())
                .thenApply(result -> ResponseEntity.ok(PredictionResponse.from(result)));
    }
}
