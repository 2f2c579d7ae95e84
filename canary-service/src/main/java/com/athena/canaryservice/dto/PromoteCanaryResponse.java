package com.athena.canaryservice.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromoteCanaryResponse {
    private String status;
    private String message;
    private String previousStableModel;
    private String newStableModel;
}
