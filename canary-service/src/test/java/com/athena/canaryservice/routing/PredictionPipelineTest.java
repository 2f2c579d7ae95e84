package com.athena.canaryservice.routing;

import com.athena.canaryservice.exception.InvalidInputException;
import com.athena.canaryservice.exception.ModelLoadException;
import com.athena.canaryservice.metrics.LatencyRecorder;
import com.athena.canaryservice.model.ModelHandle;
import com.athena.canaryservice.model.ModelVariant;
import com.athena.canaryservice.registry.ModelRegistry;
import com.athena.canaryservice.state.DeploymentStateMachine;
import com.athena.canaryservice.support.CyclicRandom;
import com.athena.canaryservice.support.FakeLatencyTimer;
import com.athena.canaryservice.support.SteppingModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PredictionPipeline Tests")
class PredictionPipelineTest {

    private static final List<Double> FEATURES = List.of(0.1, 0.2, 0.3, 0.4, 0.5);

    private FakeLatencyTimer timer;
    private LatencyRecorder recorder;
    private DeploymentStateMachine stateMachine;
    private PredictionPipeline pipeline;

    @BeforeEach
    void setUp() {
        timer = new FakeLatencyTimer();
        recorder = new LatencyRecorder();
        ModelRegistry registry = mock(ModelRegistry.class);
        when(registry.load("canary.json")).thenReturn(
                new ModelHandle("canary.json", new SteppingModel(timer, 3, 0.8, 5)));
        when(registry.load("narrow.json")).thenReturn(
                new ModelHandle("narrow.json", new SteppingModel(timer, 3, 0.8, 4)));
        stateMachine = new DeploymentStateMachine(
                new ModelHandle("stable.json", new SteppingModel(timer, 2, 0.2, 5)),
                registry, recorder, Clock.systemUTC());
        // draws alternate canary, stable
        pipeline = new PredictionPipeline(stateMachine, new TrafficRouter(new CyclicRandom(0.01, 0.99)),
                recorder, timer, 10);
    }

    @Test
    @DisplayName("No canary → stable serves and its latency is recorded")
    void shouldServeFromStableWithoutCanary() {
        PredictionResult result = pipeline.routeAndPredict(FEATURES);

        assertThat(result.getVariant()).isEqualTo(ModelVariant.STABLE);
        assertThat(result.getProbability()).isEqualTo(0.2);
        assertThat(result.getLatencyMs()).isEqualTo(2.0);
        assertThat(result.getRequestId()).startsWith("req_");
        assertThat(recorder.snapshot(ModelVariant.STABLE)).containsExactly(2.0);
        assertThat(recorder.snapshot(ModelVariant.CANARY)).isEmpty();
    }

    @Test
    @DisplayName("Canary active → latency is recorded under the variant that served")
    void shouldRecordUnderServingVariant() {
        stateMachine.deployCanary("canary.json");

        PredictionResult first = pipeline.routeAndPredict(FEATURES);
        PredictionResult second = pipeline.routeAndPredict(FEATURES);

        assertThat(first.getVariant()).isEqualTo(ModelVariant.CANARY);
        assertThat(first.getProbability()).isEqualTo(0.8);
        assertThat(second.getVariant()).isEqualTo(ModelVariant.STABLE);
        assertThat(recorder.snapshot(ModelVariant.CANARY)).containsExactly(3.0);
        assertThat(recorder.snapshot(ModelVariant.STABLE)).containsExactly(2.0);
    }

    @Test
    @DisplayName("Slowdown adds the delay inside the timed region, canary only")
    void shouldInjectSlowdownForCanaryOnly() {
        stateMachine.deployCanary("canary.json");
        stateMachine.toggleSlowdown();

        PredictionResult canary = pipeline.routeAndPredict(FEATURES);
        PredictionResult stable = pipeline.routeAndPredict(FEATURES);

        assertThat(canary.getLatencyMs()).isEqualTo(13.0);
        assertThat(stable.getLatencyMs()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Slowdown flag without canary has no effect")
    void shouldIgnoreSlowdownWithoutCanary() {
        stateMachine.toggleSlowdown();

        assertThat(pipeline.routeAndPredict(FEATURES).getLatencyMs()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Canary with a different feature count is refused and stable keeps serving")
    void shouldKeepServingAfterRejectedNarrowCanary() {
        assertThatThrownBy(() -> stateMachine.deployCanary("narrow.json"))
                .isInstanceOf(ModelLoadException.class);

        for (int i = 0; i < 100; i++) {
            assertThat(pipeline.routeAndPredict(FEATURES).getVariant()).isEqualTo(ModelVariant.STABLE);
        }
        assertThat(recorder.snapshot(ModelVariant.STABLE)).hasSize(100);
    }

    @Test
    @DisplayName("Interrupted slowdown → prediction returned, canary latency not recorded")
    void shouldNotRecordCanaryLatencyWhenSlowdownInterrupted() {
        LatencyTimer interrupting = new LatencyTimer() {
            @Override
            public long nanoTime() {
                return timer.nanoTime();
            }

            @Override
            public void sleep(long millis) throws InterruptedException {
                throw new InterruptedException();
            }
        };
        PredictionPipeline interrupted = new PredictionPipeline(stateMachine,
                new TrafficRouter(new CyclicRandom(0.01)), recorder, interrupting, 10);
        stateMachine.deployCanary("canary.json");
        stateMachine.toggleSlowdown();

        try {
            PredictionResult result = interrupted.routeAndPredict(FEATURES);

            assertThat(result.getVariant()).isEqualTo(ModelVariant.CANARY);
            assertThat(result.getProbability()).isEqualTo(0.8);
            assertThat(recorder.snapshot(ModelVariant.CANARY)).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Empty or missing feature vector → InvalidInputException")
    void shouldRejectEmptyFeatures() {
        assertThatThrownBy(() -> pipeline.routeAndPredict(List.of()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> pipeline.routeAndPredict(null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Non-finite or null feature → InvalidInputException")
    void shouldRejectNonFiniteFeatures() {
        assertThatThrownBy(() -> pipeline.routeAndPredict(List.of(0.1, Double.NaN, 0.3, 0.4, 0.5)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Feature 1");
        assertThatThrownBy(() -> pipeline.routeAndPredict(Arrays.asList(0.1, 0.2, null, 0.4, 0.5)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> pipeline.routeAndPredict(List.of(0.1, 0.2, 0.3, Double.POSITIVE_INFINITY, 0.5)))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Wrong dimension → InvalidInputException and nothing recorded")
    void shouldRejectWrongDimension() {
        assertThatThrownBy(() -> pipeline.routeAndPredict(List.of(0.1, 0.2, 0.3)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Expected 5 features but got 3");

        assertThat(recorder.snapshot(ModelVariant.STABLE)).isEmpty();
    }
}
