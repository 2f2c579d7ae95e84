package com.athena.canaryservice.routing;

import com.athena.canaryservice.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;

/**
 * Stable/canary traffic router.
 * Sends a fixed {@value #CANARY_TRAFFIC_FRACTION} share of requests to the canary when one is active,
 * using an independent random draw per request.
 */
@Slf4j
public class TrafficRouter {

    public static final double CANARY_TRAFFIC_FRACTION = 0.10;

    private final Random random;

    public TrafficRouter(Random random) {
        this.random = random;
    }

    /**
     * Return the variant for this request.
     * No canary → always STABLE.
     * Canary active → CANARY with probability 0.10.
     */
    public ModelVariant route(boolean canaryActive) {
        if (canaryActive && random.nextDouble() < CANARY_TRAFFIC_FRACTION) {
            log.debug("Routing to CANARY (fraction: {})", CANARY_TRAFFIC_FRACTION);
            return ModelVariant.CANARY;
        }
        return ModelVariant.STABLE;
    }
}
