package com.athena.canaryservice.dto;

import lombok.*;
import jakarta.validation.constraints.NotBlank;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployCanaryRequest {
    @NotBlank private String modelPath;
}
