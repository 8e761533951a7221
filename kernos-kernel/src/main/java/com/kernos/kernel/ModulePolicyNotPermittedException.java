package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Thrown by a module's permissioned guard when the caller holds no grant for
 * {@code (keycode, entryPoint)}, presents a capability that is no longer valid, or calls a
 * module instance that is not the one installed for its keycode.
 */
public final class ModulePolicyNotPermittedException extends KernelException {

    private final Address policy;
    private final Keycode keycode;
    private final String entryPoint;

    public ModulePolicyNotPermittedException(Address policy, Keycode keycode, String entryPoint) {
        super(ErrorCategory.AUTHORIZATION,
                String.format("Policy %s is not permitted to call %s.%s", policy, keycode, entryPoint));
        this.policy = policy;
        this.keycode = keycode;
        this.entryPoint = entryPoint;
    }

    /** Holder of the presented capability; null when no capability was presented. */
    public Address getPolicy() {
        return policy;
    }

    public Keycode getKeycode() {
        return keycode;
    }

    public String getEntryPoint() {
        return entryPoint;
    }
}
