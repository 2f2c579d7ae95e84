package com.athena.canaryservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk JSON form of a logistic-regression model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelArtifact {
    private String name;
    private String version;
    private Double intercept;
    private List<Double> coefficients;
}
