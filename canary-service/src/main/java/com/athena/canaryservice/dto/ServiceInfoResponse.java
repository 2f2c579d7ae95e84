package com.athena.canaryservice.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceInfoResponse {
    private String message;
    private String stableModel;
    private String canaryModel;
    private boolean canaryActive;
    private boolean simulateSlowdown;
}
