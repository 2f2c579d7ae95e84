package com.athena.canaryservice.controller;

import com.athena.canaryservice.dto.ServiceInfoResponse;
import com.athena.canaryservice.service.CanaryDeploymentService;
import com.athena.canaryservice.state.DeploymentSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Service Info", description = "Current stable and canary models")
public class ServiceInfoController {

    private final CanaryDeploymentService canaryService;

    @GetMapping("/")
    @Operation(summary = "Show which models are serving traffic")
    public ResponseEntity<ServiceInfoResponse> info() {
        DeploymentSnapshot state = canaryService.currentState();
        return ResponseEntity.ok(ServiceInfoResponse.builder()
                .message("Churn Prediction API")
                .stableModel(state.getStable().getPath())
                .canaryModel(state.hasCanary() ? state.getCanary().getPath() : null)
                .canaryActive(state.hasCanary())
                .simulateSlowdown(state.isSimulateSlowdown())
                .build());
    }
}
