package com.athena.canaryservice.state;

import com.athena.canaryservice.exception.InvalidStateException;
import com.athena.canaryservice.exception.ModelLoadException;
import com.athena.canaryservice.metrics.LatencyRecorder;
import com.athena.canaryservice.model.ModelHandle;
import com.athena.canaryservice.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the stable and canary model handles and drives the NO_CANARY / CANARY_ACTIVE lifecycle.
 * <p>
 * Every read and transition runs under one lock. The lock is never held while a model predicts;
 * readers take a {@link DeploymentSnapshot} and release it. A deploy may reset the
 * {@link LatencyRecorder} while holding this lock; the recorder never calls back here.
 */
@Slf4j
public class DeploymentStateMachine {

    private final ReentrantLock lock = new ReentrantLock();
    private final ModelRegistry modelRegistry;
    private final LatencyRecorder latencyRecorder;
    private final Clock clock;

    private ModelHandle stable;
    private ModelHandle canary;
    private Instant canaryStartedAt;
    private boolean simulateSlowdown;

    public DeploymentStateMachine(ModelHandle stable, ModelRegistry modelRegistry,
                                  LatencyRecorder latencyRecorder, Clock clock) {
        this.stable = Objects.requireNonNull(stable, "stable model is required");
        this.modelRegistry = modelRegistry;
        this.latencyRecorder = latencyRecorder;
        this.clock = clock;
    }

    public DeploymentSnapshot snapshot() {
        lock.lock();
        try {
            return new DeploymentSnapshot(stable, canary, canaryStartedAt, simulateSlowdown);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loads the artifact at {@code path} and installs it as the canary. The artifact is loaded
     * outside the lock; the phase is checked again before the handle is installed, so a deploy
     * that loses a race is rejected and leaves nothing behind. A canary must take the same
     * number of features as stable.
     */
    public DeploymentSnapshot deployCanary(String path) {
        lock.lock();
        try {
            ensureNoCanary();
        } finally {
            lock.unlock();
        }

        ModelHandle loaded = modelRegistry.load(path);

        lock.lock();
        try {
            ensureNoCanary();
            int expected = stable.getModel().featureCount();
            int actual = loaded.getModel().featureCount();
            if (actual != expected) {
                throw new ModelLoadException(path, "Canary model expects " + actual
                        + " features but stable expects " + expected, false);
            }
            canary = loaded;
            canaryStartedAt = clock.instant();
            latencyRecorder.resetAll();
            log.info("Canary deployed: path={}, startedAt={}", path, canaryStartedAt);
            return new DeploymentSnapshot(stable, canary, canaryStartedAt, simulateSlowdown);
        } finally {
            lock.unlock();
        }
    }

    public void rollbackCanary() {
        lock.lock();
        try {
            if (canary == null) {
                throw new InvalidStateException("No active canary to rollback");
            }
            log.info("Canary rolled back: path={}, stable remains {}", canary.getPath(), stable.getPath());
            canary = null;
            canaryStartedAt = null;
        } finally {
            lock.unlock();
        }
    }

    public Promotion promoteCanary() {
        lock.lock();
        try {
            if (canary == null) {
                throw new InvalidStateException("No active canary to promote");
            }
            Promotion promotion = new Promotion(stable.getPath(), canary.getPath());
            stable = canary;
            canary = null;
            canaryStartedAt = null;
            log.info("Canary promoted to stable: {} -> {}", promotion.getPreviousStablePath(), promotion.getNewStablePath());
            return promotion;
        } finally {
            lock.unlock();
        }
    }

    /** @return the flag value after the flip */
    public boolean toggleSlowdown() {
        lock.lock();
        try {
            simulateSlowdown = !simulateSlowdown;
            log.info("Slowdown simulation {}", simulateSlowdown ? "enabled" : "disabled");
            return simulateSlowdown;
        } finally {
            lock.unlock();
        }
    }

    private void ensureNoCanary() {
        if (canary != null) {
            throw new InvalidStateException("Canary already active: " + canary.getPath()
                    + ". Roll back or promote it first.");
        }
    }
}
