package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Thrown when a dependent policy fails to refresh during a module upgrade. The upgrade is rolled back.
 */
public final class KernelRefreshFailedException extends KernelException {

    /** Which step of the upgrade refresh failed. */
    public enum Phase {
        /** Before the registry swap; nothing had changed. */
        VERIFY,
        /** After the swap; kernel state was restored and refreshed dependents compensated. */
        COMMIT
    }

    private final Address policy;
    private final Keycode keycode;
    private final Phase phase;

    public KernelRefreshFailedException(Address policy, Keycode keycode, Phase phase, Throwable cause) {
        super(ErrorCategory.CONSISTENCY,
                String.format("Policy %s failed to refresh for upgrade of %s (%s): %s",
                        policy, keycode, phase, cause != null ? cause.getMessage() : "unknown"),
                cause);
        this.policy = policy;
        this.keycode = keycode;
        this.phase = phase;
    }

    public Address getPolicy() {
        return policy;
    }

    public Keycode getKeycode() {
        return keycode;
    }

    public Phase getPhase() {
        return phase;
    }
}
