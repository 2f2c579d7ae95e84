package com.athena.canaryservice.health;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one canary health evaluation. {@code pValue}, {@code tStatistic} and
 * {@code degreesOfFreedom} are null when no test ran; a mean is null when its variant has no samples.
 */
@Value
@Builder
public class HealthCheckResult {

    public enum Outcome { INSUFFICIENT_DATA, ACCEPTABLE, ALERT }

    Outcome outcome;
    boolean alert;
    Double pValue;
    Double tStatistic;
    Double degreesOfFreedom;
    Double stableMeanMs;
    Double canaryMeanMs;
    int stableCount;
    int canaryCount;
    String message;
}
