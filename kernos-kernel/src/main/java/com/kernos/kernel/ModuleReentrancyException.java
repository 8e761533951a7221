package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/** Thrown when a module's non-reentrant section is entered while it is already running. */
public final class ModuleReentrancyException extends KernelException {

    private final Keycode keycode;

    public ModuleReentrancyException(Keycode keycode) {
        super(ErrorCategory.CONSISTENCY, "Re-entrant call into module " + keycode);
        this.keycode = keycode;
    }

    public Keycode getKeycode() {
        return keycode;
    }
}
