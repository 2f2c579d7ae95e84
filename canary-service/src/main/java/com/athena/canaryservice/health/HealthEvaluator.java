package com.athena.canaryservice.health;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Component;

/**
 * Compares canary latency against stable latency with Welch's unequal-variance t-test.
 * <p>
 * An alert is raised when the two-tailed p-value is below {@value #SIGNIFICANCE_LEVEL}
 * and the canary mean is higher than the stable mean. Fewer than {@value #MIN_SAMPLES}
 * samples on either side yields an "insufficient data" result without running the test.
 * Stateless; callers pass in snapshots.
 */
@Component
@Slf4j
public class HealthEvaluator {

    public static final int MIN_SAMPLES = 20;
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    static final String INSUFFICIENT_DATA_MESSAGE =
            "Insufficient data for statistical analysis. Need at least " + MIN_SAMPLES + " samples for both models.";
    static final String ACCEPTABLE_MESSAGE = "Canary performance is acceptable.";
    static final String ALERT_MESSAGE = "ALERT: Canary latency is significantly higher than stable.";

    public HealthCheckResult evaluate(double[] stableSamples, double[] canarySamples) {
        SummaryStatistics stable = summarize(stableSamples);
        SummaryStatistics canary = summarize(canarySamples);
        int nStable = (int) stable.getN();
        int nCanary = (int) canary.getN();

        if (nStable < MIN_SAMPLES || nCanary < MIN_SAMPLES) {
            return HealthCheckResult.builder()
                    .outcome(HealthCheckResult.Outcome.INSUFFICIENT_DATA)
                    .alert(false)
                    .stableMeanMs(meanOrNull(stable))
                    .canaryMeanMs(meanOrNull(canary))
                    .stableCount(nStable)
                    .canaryCount(nCanary)
                    .message(INSUFFICIENT_DATA_MESSAGE)
                    .build();
        }

        double meanStable = stable.getMean();
        double meanCanary = canary.getMean();
        // SummaryStatistics.getVariance() is the bias-corrected (n - 1) sample variance
        double seStable = stable.getVariance() / nStable;
        double seCanary = canary.getVariance() / nCanary;
        double standardError = Math.sqrt(seStable + seCanary);

        Double t;
        Double df;
        double pValue;
        if (standardError == 0.0) {
            t = null;
            df = null;
            pValue = meanCanary == meanStable ? 1.0 : 0.0;
        } else {
            t = (meanCanary - meanStable) / standardError;
            df = (seStable + seCanary) * (seStable + seCanary)
                    / (seStable * seStable / (nStable - 1) + seCanary * seCanary / (nCanary - 1));
            pValue = 2.0 * new TDistribution(df).cumulativeProbability(-Math.abs(t));
        }

        boolean alert = pValue < SIGNIFICANCE_LEVEL && meanCanary > meanStable;
        if (alert) {
            log.warn("Canary latency alert: canary={}ms stable={}ms p={}", meanCanary, meanStable, pValue);
        } else {
            log.debug("Canary latency acceptable: canary={}ms stable={}ms p={}", meanCanary, meanStable, pValue);
        }

        return HealthCheckResult.builder()
                .outcome(alert ? HealthCheckResult.Outcome.ALERT : HealthCheckResult.Outcome.ACCEPTABLE)
                .alert(alert)
                .pValue(pValue)
                .tStatistic(t)
                .degreesOfFreedom(df)
                .stableMeanMs(meanStable)
                .canaryMeanMs(meanCanary)
                .stableCount(nStable)
                .canaryCount(nCanary)
                .message(alert ? ALERT_MESSAGE : ACCEPTABLE_MESSAGE)
                .build();
    }

    private static SummaryStatistics summarize(double[] samples) {
        SummaryStatistics stats = new SummaryStatistics();
        if (samples != null) {
            for (double sample : samples) {
                stats.addValue(sample);
            }
        }
        return stats;
    }

    private static Double meanOrNull(SummaryStatistics stats) {
        return stats.getN() == 0 ? null : stats.getMean();
    }
}
