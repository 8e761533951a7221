package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.List;

/** Thrown when deprecating a module that an active policy still depends on or holds permissions for. */
public final class KernelModuleInUseException extends KernelException {

    private final Keycode keycode;
    private final List<Address> policies;

    public KernelModuleInUseException(Keycode keycode, List<Address> policies) {
        super(ErrorCategory.LIFECYCLE,
                String.format("Module %s is still used by active policies %s", keycode, policies));
        this.keycode = keycode;
        this.policies = List.copyOf(policies);
    }

    public Keycode getKeycode() {
        return keycode;
    }

    /** Active policies that blocked the deprecation. */
    public List<Address> getPolicies() {
        return policies;
    }
}
