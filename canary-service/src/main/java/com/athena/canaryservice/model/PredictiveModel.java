package com.athena.canaryservice.model;

/**
 * A loaded, servable model: takes one feature vector and returns the churn probability.
 * Implementations must be immutable so they can be shared across request threads.
 */
public interface PredictiveModel {

    /**
     * @param features feature vector of length {@link #featureCount()}
     * @return probability of the positive class, in [0, 1]
     */
    double predict(double[] features);

    int featureCount();
}
