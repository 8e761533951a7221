package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/** Thrown when installing a module whose keycode is already taken. */
public final class KernelModuleAlreadyInstalledException extends KernelException {

    private final Keycode keycode;

    public KernelModuleAlreadyInstalledException(Keycode keycode) {
        super(ErrorCategory.IDENTITY, "Module already installed for keycode " + keycode);
        this.keycode = keycode;
    }

    public Keycode getKeycode() {
        return keycode;
    }
}
