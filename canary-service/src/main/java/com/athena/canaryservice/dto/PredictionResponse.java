package com.athena.canaryservice.dto;

import com.athena.canaryservice.model.ModelVariant;
import com.athena.canaryservice.routing.PredictionResult;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResponse {
    private double churnProbability;
    private ModelVariant modelUsed;
    private double latencyMs;
    private String requestId;

    public static PredictionResponse from(PredictionResult result) {
        return PredictionResponse.builder()
                .churnProbability(result.getProbability())
                .modelUsed(result.getVariant())
                .latencyMs(result.getLatencyMs())
                .requestId(result.getRequestId())
                .build();
    }
}
