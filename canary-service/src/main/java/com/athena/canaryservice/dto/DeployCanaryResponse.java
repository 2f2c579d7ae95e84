package com.athena.canaryservice.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployCanaryResponse {
    private String status;
    private String message;
    private String modelPath;
    private String canaryStartTime;
}
