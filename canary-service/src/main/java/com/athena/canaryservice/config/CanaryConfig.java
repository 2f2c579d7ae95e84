package com.athena.canaryservice.config;

import com.athena.canaryservice.metrics.LatencyRecorder;
import com.athena.canaryservice.model.ModelHandle;
import com.athena.canaryservice.registry.ModelRegistry;
import com.athena.canaryservice.routing.LatencyTimer;
import com.athena.canaryservice.routing.PredictionPipeline;
import com.athena.canaryservice.routing.TrafficRouter;
import com.athena.canaryservice.state.DeploymentStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;

@Configuration
@Slf4j
public class CanaryConfig {

    public static final String PREDICTION_EXECUTOR = "predictionExecutor";

    @Value("${canary.stable-model-path:models/model_v1.json}")
    private String stableModelPath;

    @Value("${canary.slowdown-ms:10}")
    private long slowdownMs;

    @Bean public Clock clock()               { return Clock.systemUTC(); }
    @Bean public LatencyTimer latencyTimer() { return LatencyTimer.SYSTEM; }

    @Bean
    public TrafficRouter trafficRouter() {
        return new TrafficRouter(new Random());
    }

    // Startup fails here if the stable model cannot be loaded
    @Bean
    public DeploymentStateMachine deploymentStateMachine(ModelRegistry modelRegistry,
                                                         LatencyRecorder latencyRecorder,
                                                         Clock clock) {
        ModelHandle stable = modelRegistry.load(stableModelPath);
        log.info("Stable model initialised from {}", stableModelPath);
        return new DeploymentStateMachine(stable, modelRegistry, latencyRecorder, clock);
    }

    @Bean
    public PredictionPipeline predictionPipeline(DeploymentStateMachine deploymentStateMachine,
                                                 TrafficRouter trafficRouter,
                                                 LatencyRecorder latencyRecorder,
                                                 LatencyTimer latencyTimer) {
        return new PredictionPipeline(deploymentStateMachine, trafficRouter, latencyRecorder, latencyTimer, slowdownMs);
    }

    @Bean(name = PREDICTION_EXECUTOR)
    public ThreadPoolTaskExecutor predictionExecutor(
            @Value("${canary.executor.core-pool-size:4}") int corePoolSize,
            @Value("${canary.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${canary.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("predict-");
        executor.initialize();
        return executor;
    }
}
