package com.kernos.keycode;

/**
 * Thrown when a value cannot be converted to a {@link SubKeycode}, or when a sub-keycode does not
 * live under the expected parent keycode.
 */
public final class InvalidSubKeycodeException extends IllegalArgumentException {

    private final String rawValue;

    public InvalidSubKeycodeException(String rawValue, String reason) {
        super(String.format("Invalid sub-keycode '%s': %s", rawValue, reason));
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
