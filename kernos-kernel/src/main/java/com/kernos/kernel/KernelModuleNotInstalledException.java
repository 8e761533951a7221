package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Thrown when an action references a keycode that has no installed module, or a module instance
 * that is not the installed one.
 */
public final class KernelModuleNotInstalledException extends KernelException {

    private final Keycode keycode;

    public KernelModuleNotInstalledException(Keycode keycode) {
        super(ErrorCategory.LIFECYCLE, "No module installed for keycode " + keycode);
        this.keycode = keycode;
    }

    public Keycode getKeycode() {
        return keycode;
    }
}
