package com.athena.canaryservice.routing;

import com.athena.canaryservice.model.ModelVariant;
import lombok.Value;

@Value
public class PredictionResult {
    String requestId;
    double probability;
    ModelVariant variant;
    double latencyMs;
}
