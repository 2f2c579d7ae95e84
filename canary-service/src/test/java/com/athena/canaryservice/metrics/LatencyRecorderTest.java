package com.athena.canaryservice.metrics;

import com.athena.canaryservice.model.ModelVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LatencyRecorder Tests")
class LatencyRecorderTest {

    private LatencyRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new LatencyRecorder();
    }

    @Test
    @DisplayName("Samples are kept per variant in arrival order")
    void shouldRecordPerVariantInOrder() {
        recorder.record(ModelVariant.STABLE, 1.5);
        recorder.record(ModelVariant.CANARY, 9.0);
        recorder.record(ModelVariant.STABLE, 2.5);

        assertThat(recorder.snapshot(ModelVariant.STABLE)).containsExactly(1.5, 2.5);
        assertThat(recorder.snapshot(ModelVariant.CANARY)).containsExactly(9.0);
    }

    @Test
    @DisplayName("Snapshot is a copy, not a live view")
    void shouldReturnDetachedSnapshot() {
        recorder.record(ModelVariant.CANARY, 3.0);
        double[] snapshot = recorder.snapshot(ModelVariant.CANARY);

        recorder.record(ModelVariant.CANARY, 4.0);
        snapshot[0] = -1.0;

        assertThat(snapshot).hasSize(1);
        assertThat(recorder.snapshot(ModelVariant.CANARY)).containsExactly(3.0, 4.0);
    }

    @Test
    @DisplayName("snapshotAll copies both variants together")
    void shouldSnapshotAllVariants() {
        recorder.record(ModelVariant.STABLE, 1.0);
        recorder.record(ModelVariant.CANARY, 2.0);

        Map<ModelVariant, double[]> samples = recorder.snapshotAll();
        recorder.resetAll();

        assertThat(samples).containsOnlyKeys(ModelVariant.STABLE, ModelVariant.CANARY);
        assertThat(samples.get(ModelVariant.STABLE)).containsExactly(1.0);
        assertThat(samples.get(ModelVariant.CANARY)).containsExactly(2.0);
    }

    @Test
    @DisplayName("resetAll clears both variants")
    void shouldClearBothVariants() {
        recorder.record(ModelVariant.STABLE, 1.0);
        recorder.record(ModelVariant.CANARY, 2.0);

        recorder.resetAll();

        assertThat(recorder.snapshot(ModelVariant.STABLE)).isEmpty();
        assertThat(recorder.snapshot(ModelVariant.CANARY)).isEmpty();
    }

    @Test
    @DisplayName("Concurrent appends are not lost")
    void shouldNotLoseConcurrentAppends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                ModelVariant variant = t % 2 == 0 ? ModelVariant.STABLE : ModelVariant.CANARY;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        recorder.record(variant, i);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(recorder.snapshot(ModelVariant.STABLE)).hasSize(4000);
        assertThat(recorder.snapshot(ModelVariant.CANARY)).hasSize(4000);
    }
}
