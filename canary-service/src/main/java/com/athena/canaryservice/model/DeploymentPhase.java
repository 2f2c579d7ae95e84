package com.athena.canaryservice.model;

public enum DeploymentPhase {
    NO_CANARY,
    CANARY_ACTIVE
}
