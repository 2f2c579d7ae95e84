package com.athena.canaryservice.controller;

import com.athena.canaryservice.dto.*;
import com.athena.canaryservice.service.CanaryDeploymentService;
import com.athena.canaryservice.state.DeploymentSnapshot;
import com.athena.canaryservice.state.Promotion;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Canary lifecycle endpoints.
 * Deploy, rollback, promote, slowdown simulation and latency health check.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Canary Admin", description = "Canary deployment lifecycle and latency health checks")
public class AdminController {

    private final CanaryDeploymentService canaryService;

    // ── POST deploy canary ────────────────────────────────────────────────────

    @PostMapping("/deploy-canary")
    @Operation(summary = "Load a model artifact and start routing 10% of traffic to it")
    public ResponseEntity<DeployCanaryResponse> deployCanary(@Valid @RequestBody DeployCanaryRequest request) {
        DeploymentSnapshot state = canaryService.deployCanary(request.getModelPath());
        return ResponseEntity.ok(DeployCanaryResponse.builder()
                .status("success")
                .message("Canary model deployed successfully")
                .modelPath(state.getCanary().getPath())
                .canaryStartTime(state.getCanaryStartedAt().toString())
                .build());
    }

    // ── POST rollback canary ──────────────────────────────────────────────────

    @PostMapping("/rollback-canary")
    @Operation(summary = "Discard the active canary and serve all traffic from stable")
    public ResponseEntity<StatusResponse> rollbackCanary() {
        canaryService.rollbackCanary();
        return ResponseEntity.ok(StatusResponse.builder()
                .status("success")
                .message("Canary rolled back successfully")
                .build());
    }

    // ── POST promote canary ───────────────────────────────────────────────────

    @PostMapping("/promote-canary")
    @Operation(summary = "Promote the active canary to stable")
    public ResponseEntity<PromoteCanaryResponse> promoteCanary() {
        Promotion promotion = canaryService.promoteCanary();
        return ResponseEntity.ok(PromoteCanaryResponse.builder()
                .status("success")
                .message("Canary promoted to stable successfully")
                .previousStableModel(promotion.getPreviousStablePath())
                .newStableModel(promotion.getNewStablePath())
                .build());
    }

    // ── POST toggle slowdown ──────────────────────────────────────────────────

    @PostMapping("/toggle-slowdown")
    @Operation(summary = "Toggle the artificial canary slowdown used to exercise the health check")
    public ResponseEntity<SlowdownResponse> toggleSlowdown() {
        boolean enabled = canaryService.toggleSlowdown();
        return ResponseEntity.ok(SlowdownResponse.builder()
                .simulateSlowdown(enabled)
                .message(enabled ? "Slowdown simulation enabled" : "Slowdown simulation disabled")
                .build());
    }

    // ── GET canary health ─────────────────────────────────────────────────────

    @GetMapping("/check-canary-health")
    @Operation(summary = "Compare canary vs stable latency with Welch's t-test")
    public ResponseEntity<HealthCheckResponse> checkCanaryHealth() {
        return ResponseEntity.ok(HealthCheckResponse.from(canaryService.checkCanaryHealth()));
    }
}
