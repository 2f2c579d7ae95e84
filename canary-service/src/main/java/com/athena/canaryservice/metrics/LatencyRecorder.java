package com.athena.canaryservice.metrics;

import com.athena.canaryservice.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only latency samples per variant.
 * Guarded by its own monitor, separate from the deployment state lock.
 */
@Component
@Slf4j
public class LatencyRecorder {

    private final Object lock = new Object();
    private final Map<ModelVariant, List<Double>> latencies = new EnumMap<>(ModelVariant.class);

    public LatencyRecorder() {
        for (ModelVariant variant : ModelVariant.values()) {
            latencies.put(variant, new ArrayList<>());
        }
    }

    public void record(ModelVariant variant, double latencyMs) {
        synchronized (lock) {
            latencies.get(variant).add(latencyMs);
        }
    }

    /** Returns a copy; later appends are not visible through it. */
    public double[] snapshot(ModelVariant variant) {
        synchronized (lock) {
            List<Double> samples = latencies.get(variant);
            double[] copy = new double[samples.size()];
            for (int i = 0; i < copy.length; i++) {
                copy[i] = samples.get(i);
            }
            return copy;
        }
    }

    /** Copies every variant under a single hold of the lock. */
    public Map<ModelVariant, double[]> snapshotAll() {
        synchronized (lock) {
            Map<ModelVariant, double[]> copy = new EnumMap<>(ModelVariant.class);
            for (ModelVariant variant : ModelVariant.values()) {
                copy.put(variant, snapshot(variant));
            }
            return copy;
        }
    }

    public void resetAll() {
        synchronized (lock) {
            latencies.values().forEach(List::clear);
        }
        log.info("Latency metrics reset for all variants");
    }
}
