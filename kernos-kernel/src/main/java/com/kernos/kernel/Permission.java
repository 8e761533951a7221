package com.kernos.kernel;

import com.kernos.keycode.Keycode;

import java.util.Objects;

/**
 * A permission request or grant: one entry point on the module installed under {@code keycode}.
 * Paired with a policy address it forms one cell of the kernel's permission matrix.
 */
public record Permission(Keycode keycode, String entryPoint) {

    public Permission {
        Objects.requireNonNull(keycode, "keycode");
        Objects.requireNonNull(entryPoint, "entryPoint");
        entryPoint = entryPoint.trim();
        if (entryPoint.isEmpty()) {
            throw new IllegalArgumentException("entryPoint must be non-blank");
        }
    }

    public static Permission of(Keycode keycode, String entryPoint) {
        return new Permission(keycode, entryPoint);
    }

    @Override
    public String toString() {
        return keycode + "." + entryPoint;
    }
}
