package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/**
 * Thrown by {@link Policy#getModule(Keycode, Class)} when no module is installed for the keycode,
 * or the installed module is not of the requested type.
 */
public final class PolicyModuleDoesNotExistException extends KernelException {

    private final Keycode keycode;

    public PolicyModuleDoesNotExistException(Keycode keycode) {
        super(ErrorCategory.LIFECYCLE, "Module does not exist: " + keycode);
        this.keycode = keycode;
    }

    public PolicyModuleDoesNotExistException(Keycode keycode, Class<?> expectedType) {
        super(ErrorCategory.LIFECYCLE,
                String.format("Module %s is not a %s", keycode, expectedType.getSimpleName()));
        this.keycode = keycode;
    }

    public Keycode getKeycode() {
        return keycode;
    }
}
