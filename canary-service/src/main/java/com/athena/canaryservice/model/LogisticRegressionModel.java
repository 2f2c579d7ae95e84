package com.athena.canaryservice.model;

import java.util.Arrays;

/**
 * Binary logistic regression: sigmoid(intercept + coefficients · features).
 */
public final class LogisticRegressionModel implements PredictiveModel {

    private final String name;
    private final double intercept;
    private final double[] coefficients;

    public LogisticRegressionModel(String name, double intercept, double[] coefficients) {
        this.name = name;
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
    }

    @Override
    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length
                    + " features but got " + features.length);
        }
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * features[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public int featureCount() {
        return coefficients.length;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "LogisticRegressionModel{name=" + name + ", intercept=" + intercept
                + ", coefficients=" + Arrays.toString(coefficients) + "}";
    }
}
