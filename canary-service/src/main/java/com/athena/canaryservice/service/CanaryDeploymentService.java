package com.athena.canaryservice.service;

import com.athena.canaryservice.config.CanaryConfig;
import com.athena.canaryservice.health.HealthCheckResult;
import com.athena.canaryservice.health.HealthEvaluator;
import com.athena.canaryservice.metrics.LatencyRecorder;
import com.athena.canaryservice.model.ModelVariant;
import com.athena.canaryservice.routing.PredictionPipeline;
import com.athena.canaryservice.routing.PredictionResult;
import com.athena.canaryservice.state.DeploymentSnapshot;
import com.athena.canaryservice.state.DeploymentStateMachine;
import com.athena.canaryservice.state.Promotion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Operational surface of the canary rollout: predict, deploy, rollback, promote,
 * toggle slowdown and health check.
 */
@Service
@Slf4j
public class CanaryDeploymentService {

    private final DeploymentStateMachine stateMachine;
    private final PredictionPipeline pipeline;
    private final LatencyRecorder latencyRecorder;
    private final HealthEvaluator healthEvaluator;
    private final Executor predictionExecutor;

    public CanaryDeploymentService(DeploymentStateMachine stateMachine,
                                   PredictionPipeline pipeline,
                                   LatencyRecorder latencyRecorder,
                                   HealthEvaluator healthEvaluator,
                                   @Qualifier(CanaryConfig.PREDICTION_EXECUTOR) Executor predictionExecutor) {
        this.stateMachine = stateMachine;
        this.pipeline = pipeline;
        this.latencyRecorder = latencyRecorder;
        this.healthEvaluator = healthEvaluator;
        this.predictionExecutor = predictionExecutor;
    }

    /**
     * Runs the prediction on the worker pool. Malformed vectors are rejected
     * on the calling thread before anything is submitted.
     */
    public CompletableFuture<PredictionResult> predictAsync(List<Double> features) {
        pipeline.validate(features);
        return CompletableFuture.supplyAsync(() -> pipeline.routeAndPredict(features), predictionExecutor);
    }

    public DeploymentSnapshot deployCanary(String modelPath) {
        return stateMachine.deployCanary(modelPath);
    }

    public void rollbackCanary() {
        stateMachine.rollbackCanary();
    }

    public Promotion promoteCanary() {
        return stateMachine.promoteCanary();
    }

    public boolean toggleSlowdown() {
        return stateMachine.toggleSlowdown();
    }

    public HealthCheckResult checkCanaryHealth() {
        Map<ModelVariant, double[]> samples = latencyRecorder.snapshotAll();
        return healthEvaluator.evaluate(samples.get(ModelVariant.STABLE), samples.get(ModelVariant.CANARY));
    }

    public DeploymentSnapshot currentState() {
        return stateMachine.snapshot();
    }
}
