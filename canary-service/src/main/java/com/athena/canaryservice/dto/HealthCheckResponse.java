package com.athena.canaryservice.dto;

import com.athena.canaryservice.health.HealthCheckResult;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Serialized from fields so names like {@code pValue} map to {@code p_value}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class HealthCheckResponse {
    private boolean alertTriggered;
    private Double pValue;
    private String message;
    private Double stableAvgLatencyMs;
    private Double canaryAvgLatencyMs;
    private int stableSampleCount;
    private int canarySampleCount;
    private Double tStatistic;
    private Double degreesOfFreedom;

    public static HealthCheckResponse from(HealthCheckResult result) {
        return HealthCheckResponse.builder()
                .alertTriggered(result.isAlert())
                .pValue(round(result.getPValue(), 3))
                .message(result.getMessage())
                .stableAvgLatencyMs(round(result.getStableMeanMs(), 1))
                .canaryAvgLatencyMs(round(result.getCanaryMeanMs(), 1))
                .stableSampleCount(result.getStableCount())
                .canarySampleCount(result.getCanaryCount())
                .tStatistic(round(result.getTStatistic(), 3))
                .degreesOfFreedom(round(result.getDegreesOfFreedom(), 1))
                .build();
    }

    private static Double round(Double value, int scale) {
        if (value == null) return null;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
