package com.kernos.keycode;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Unique short identifier of a module. Exactly {@value #LENGTH} characters, each {@code A-Z}.
 * No two modules installed in one kernel share a keycode.
 */
public final class Keycode implements Comparable<Keycode> {

    /** Fixed width of every keycode. */
    public static final int LENGTH = 5;

    private final String value;

    private Keycode(String value) {
        this.value = value;
    }

    /**
     * Converts text to a keycode.
     *
     * @param value five upper-case ASCII letters
     * @return validated keycode
     * @throws InvalidKeycodeException if the value is null, not {@value #LENGTH} characters, or contains anything but A-Z
     */
    public static Keycode of(String value) {
        if (value == null) {
            throw new InvalidKeycodeException(null, "must not be null");
        }
        if (value.length() != LENGTH) {
            throw new InvalidKeycodeException(value, "must be exactly " + LENGTH + " characters");
        }
        for (int i = 0; i < LENGTH; i++) {
            char c = value.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidKeycodeException(value, "character at " + i + " is not A-Z");
            }
        }
        return new Keycode(value);
    }

    /**
     * Converts the fixed-width byte form to a keycode. No padding is accepted.
     *
     * @throws InvalidKeycodeException if the array is null, not {@value #LENGTH} bytes, or not A-Z
     */
    public static Keycode fromBytes(byte[] raw) {
        if (raw == null) {
            throw new InvalidKeycodeException(null, "must not be null");
        }
        if (raw.length != LENGTH) {
            throw new InvalidKeycodeException(new String(raw, StandardCharsets.ISO_8859_1),
                    "must be exactly " + LENGTH + " bytes");
        }
        return of(new String(raw, StandardCharsets.ISO_8859_1));
    }

    /** Fixed-width byte form (ASCII). */
    public byte[] toBytes() {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Keycode other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Keycode)) return false;
        return value.equals(((Keycode) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
