package com.athena.canaryservice.state;

import com.athena.canaryservice.model.DeploymentPhase;
import com.athena.canaryservice.model.ModelHandle;
import lombok.Value;

import java.time.Instant;

/**
 * Consistent point-in-time copy of the deployment state. {@code canary} and
 * {@code canaryStartedAt} are both null when no canary is active.
 */
@Value
public class DeploymentSnapshot {
    ModelHandle stable;
    ModelHandle canary;
    Instant canaryStartedAt;
    boolean simulateSlowdown;

    public boolean hasCanary() {
        return canary != null;
    }

    public DeploymentPhase getPhase() {
        return canary != null ? DeploymentPhase.CANARY_ACTIVE : DeploymentPhase.NO_CANARY;
    }
}
