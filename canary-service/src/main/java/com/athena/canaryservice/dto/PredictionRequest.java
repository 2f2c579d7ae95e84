package com.athena.canaryservice.dto;

import lombok.*;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {
    @NotEmpty private List<Double> features;
}
