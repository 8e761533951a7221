package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/** Thrown when upgrading a keycode that is not installed, or "upgrading" to the instance already installed. */
public final class KernelInvalidModuleUpgradeException extends KernelException {

    private final Keycode keycode;

    public KernelInvalidModuleUpgradeException(Keycode keycode) {
        super(ErrorCategory.LIFECYCLE, "Invalid module upgrade for keycode " + keycode);
        this.keycode = keycode;
    }

    public Keycode getKeycode() {
        return keycode;
    }
}
