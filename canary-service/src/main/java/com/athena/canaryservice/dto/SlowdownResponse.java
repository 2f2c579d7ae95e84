package com.athena.canaryservice.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlowdownResponse {
    private boolean simulateSlowdown;
    private String message;
}
