package com.fintech.budgetsync.service;

/**
 * Sync state of one target within a cycle.
 * <pre>
 * Idle --begin--> Attempting(1)
 * Attempting(n) --success--> Succeeded
 * Attempting(n) --failure--> Attempting(n + 1)   while n &lt; max
 * Attempting(max) --failure--> Failed
 * </pre>
 * Instances are immutable; every transition returns a new state.
 */
public final class TargetSyncState {

    public enum Phase {
        IDLE,
        ATTEMPTING,
        SUCCEEDED,
        FAILED
    }

    private final Phase phase;
    private final int attempt;
    private final int maxAttempts;

    private TargetSyncState(Phase phase, int attempt, int maxAttempts) {
        this.phase = phase;
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
    }

    public static TargetSyncState idle(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        return new TargetSyncState(Phase.IDLE, 0, maxAttempts);
    }

    public TargetSyncState begin() {
        require(Phase.IDLE, "begin");
        return new TargetSyncState(Phase.ATTEMPTING, 1, maxAttempts);
    }

    public TargetSyncState succeed() {
        require(Phase.ATTEMPTING, "succeed");
        return new TargetSyncState(Phase.SUCCEEDED, attempt, maxAttempts);
    }

    public TargetSyncState fail() {
        require(Phase.ATTEMPTING, "fail");
        if (attempt < maxAttempts) {
            return new TargetSyncState(Phase.ATTEMPTING, attempt + 1, maxAttempts);
        }
        return new TargetSyncState(Phase.FAILED, attempt, maxAttempts);
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Current attempt number, starting at 1. Zero while idle.
     */
    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isAttempting() {
        return phase == Phase.ATTEMPTING;
    }

    public boolean isRetry() {
        return phase == Phase.ATTEMPTING && attempt > 1;
    }

    private void require(Phase expected, String transition) {
        if (phase != expected) {
            throw new IllegalStateException("Cannot " + transition + " from " + this);
        }
    }

    @Override
    public String toString() {
        return switch (phase) {
            case IDLE -> "Idle";
            case ATTEMPTING -> "Attempting(" + attempt + ")";
            case SUCCEEDED -> "Succeeded";
            case FAILED -> "Failed";
        };
    }
}
