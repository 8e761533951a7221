package com.kernos.kernel;

import com.kernos.keycode.Keycode;

/** Thrown when a policy finds a dependency at a major version it was not written for. */
public final class PolicyWrongModuleVersionException extends KernelException {

    private final Keycode keycode;
    private final int expectedMajor;
    private final Version actual;

    public PolicyWrongModuleVersionException(Keycode keycode, int expectedMajor, Version actual) {
        super(ErrorCategory.CONSISTENCY,
                String.format("Module %s has version %s; expected major %d", keycode, actual, expectedMajor));
        this.keycode = keycode;
        this.expectedMajor = expectedMajor;
        this.actual = actual;
    }

    public Keycode getKeycode() {
        return keycode;
    }

    public int getExpectedMajor() {
        return expectedMajor;
    }

    public Version getActual() {
        return actual;
    }
}
