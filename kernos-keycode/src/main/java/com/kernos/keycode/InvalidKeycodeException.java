package com.kernos.keycode;

/**
 * Thrown when a value cannot be converted to a {@link Keycode}: wrong length, lower case,
 * or characters outside {@code A-Z}.
 */
public final class InvalidKeycodeException extends IllegalArgumentException {

    private final String rawValue;

    public InvalidKeycodeException(String rawValue, String reason) {
        super(String.format("Invalid keycode '%s': %s", rawValue, reason));
        this.rawValue = rawValue;
    }

    /** The rejected input as text (null when the input was null). */
    public String getRawValue() {
        return rawValue;
    }
}
