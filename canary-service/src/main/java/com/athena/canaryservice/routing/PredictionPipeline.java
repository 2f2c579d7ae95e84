package com.athena.canaryservice.routing;

import com.athena.canaryservice.exception.InvalidInputException;
import com.athena.canaryservice.metrics.LatencyRecorder;
import com.athena.canaryservice.model.ModelHandle;
import com.athena.canaryservice.model.ModelVariant;
import com.athena.canaryservice.state.DeploymentSnapshot;
import com.athena.canaryservice.state.DeploymentStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Routes one prediction to stable or canary, times the model call and records the latency
 * under the variant that served it.
 */
@Slf4j
public class PredictionPipeline {

    private final DeploymentStateMachine stateMachine;
    private final TrafficRouter router;
    private final LatencyRecorder latencyRecorder;
    private final LatencyTimer timer;
    private final long slowdownMs;

    public PredictionPipeline(DeploymentStateMachine stateMachine, TrafficRouter router,
                              LatencyRecorder latencyRecorder, LatencyTimer timer, long slowdownMs) {
        this.stateMachine = stateMachine;
        this.router = router;
        this.latencyRecorder = latencyRecorder;
        this.timer = timer;
        this.slowdownMs = slowdownMs;
    }

    /**
     * Rejects vectors that no model could score. Cheap enough to run on the caller's thread.
     */
    public double[] validate(List<Double> features) {
        if (features == null || features.isEmpty()) {
            throw new InvalidInputException("Feature vector must not be empty");
        }
        double[] vector = new double[features.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = features.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new InvalidInputException("Feature " + i + " is not a finite number: " + value);
            }
            vector[i] = value;
        }
        return vector;
    }

    public PredictionResult routeAndPredict(List<Double> features) {
        double[] vector = validate(features);
        String requestId = "req_" + UUID.randomUUID();

        DeploymentSnapshot snapshot = stateMachine.snapshot();
        ModelVariant variant = router.route(snapshot.hasCanary());
        ModelHandle handle = variant == ModelVariant.CANARY ? snapshot.getCanary() : snapshot.getStable();
        checkDimension(handle, vector);
        log.debug("[{}] Routing request to {} model ({})", requestId, variant.getTag(), handle.getPath());

        long start = timer.nanoTime();
        boolean slowdownApplied = true;
        if (variant == ModelVariant.CANARY && snapshot.isSimulateSlowdown()) {
            slowdownApplied = pause(requestId);
        }
        double probability = handle.getModel().predict(vector);
        double latencyMs = (timer.nanoTime() - start) / 1_000_000.0;

        // an interrupted slowdown would understate canary latency
        if (slowdownApplied) {
            latencyRecorder.record(variant, latencyMs);
        } else {
            log.warn("[{}] Slowdown interrupted, canary latency {}ms not recorded", requestId,
                    String.format("%.3f", latencyMs));
        }
        log.info("[{}] Request completed: model={}, latency={}ms", requestId, variant.getTag(),
                String.format("%.3f", latencyMs));
        return new PredictionResult(requestId, probability, variant, latencyMs);
    }

    private void checkDimension(ModelHandle handle, double[] vector) {
        int expected = handle.getModel().featureCount();
        if (vector.length != expected) {
            throw new InvalidInputException("Expected " + expected + " features but got " + vector.length);
        }
    }

    /** @return false if the sleep was interrupted before the full delay elapsed */
    private boolean pause(String requestId) {
        log.debug("[{}] Applying simulated slowdown of {}ms for canary model", requestId, slowdownMs);
        try {
            timer.sleep(slowdownMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
