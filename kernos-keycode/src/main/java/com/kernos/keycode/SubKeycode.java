package com.kernos.keycode;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Identifier of a submodule: parent {@link Keycode}, a {@value #SEPARATOR} separator, then a suffix.
 * At most {@value #MAX_LENGTH} characters overall; the suffix is 1..14 characters from
 * {@code A-Z}, {@code 0-9}, {@code _} and {@code .}. Sub-keycodes are unique within one parent module.
 */
public final class SubKeycode implements Comparable<SubKeycode> {

    /** Maximum width of the byte form. */
    public static final int MAX_LENGTH = 20;

    public static final char SEPARATOR = '.';

    private final String value;
    private final Keycode parent;

    private SubKeycode(String value, Keycode parent) {
        this.value = value;
        this.parent = parent;
    }

    /**
     * Parses {@code PARNT.SUFFIX}.
     *
     * @throws InvalidSubKeycodeException on any format violation
     */
    public static SubKeycode of(String value) {
        if (value == null) {
            throw new InvalidSubKeycodeException(null, "must not be null");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidSubKeycodeException(value, "longer than " + MAX_LENGTH + " characters");
        }
        if (value.length() < Keycode.LENGTH + 2) {
            throw new InvalidSubKeycodeException(value, "needs a parent keycode, '" + SEPARATOR + "' and a non-empty suffix");
        }
        Keycode parent;
        try {
            parent = Keycode.of(value.substring(0, Keycode.LENGTH));
        } catch (InvalidKeycodeException e) {
            throw new InvalidSubKeycodeException(value, "prefix is not a valid keycode");
        }
        if (value.charAt(Keycode.LENGTH) != SEPARATOR) {
            throw new InvalidSubKeycodeException(value, "character " + Keycode.LENGTH + " must be '" + SEPARATOR + "'");
        }
        for (int i = Keycode.LENGTH + 1; i < value.length(); i++) {
            if (!isSuffixChar(value.charAt(i))) {
                throw new InvalidSubKeycodeException(value, "character at " + i + " is not A-Z, 0-9, '_' or '.'");
            }
        }
        return new SubKeycode(value, parent);
    }

    /** Composes {@code parent.suffix}. */
    public static SubKeycode of(Keycode parent, String suffix) {
        Objects.requireNonNull(parent, "parent");
        return of(parent.getValue() + SEPARATOR + (suffix != null ? suffix : ""));
    }

    /**
     * Converts the byte form: up to {@value #MAX_LENGTH} bytes, optionally right-padded with zero bytes.
     * A zero byte followed by a non-zero byte is rejected.
     */
    public static SubKeycode fromBytes(byte[] raw) {
        if (raw == null) {
            throw new InvalidSubKeycodeException(null, "must not be null");
        }
        if (raw.length > MAX_LENGTH) {
            throw new InvalidSubKeycodeException(new String(raw, StandardCharsets.ISO_8859_1),
                    "longer than " + MAX_LENGTH + " bytes");
        }
        int end = raw.length;
        while (end > 0 && raw[end - 1] == 0) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            if (raw[i] == 0) {
                throw new InvalidSubKeycodeException(new String(raw, 0, end, StandardCharsets.ISO_8859_1),
                        "zero byte inside the identifier");
            }
        }
        return of(new String(raw, 0, end, StandardCharsets.ISO_8859_1));
    }

    private static boolean isSuffixChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '.';
    }

    /**
     * Rejects this sub-keycode unless it lives under {@code expectedParent}.
     *
     * @throws InvalidSubKeycodeException if the prefix differs
     */
    public void ensureParent(Keycode expectedParent) {
        Objects.requireNonNull(expectedParent, "expectedParent");
        if (!parent.equals(expectedParent)) {
            throw new InvalidSubKeycodeException(value, "parent is " + parent + ", expected " + expectedParent);
        }
    }

    /** Byte form right-padded with zeros to {@value #MAX_LENGTH} bytes. */
    public byte[] toBytes() {
        byte[] out = new byte[MAX_LENGTH];
        byte[] b = value.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(b, 0, out, 0, b.length);
        return out;
    }

    public Keycode getParent() {
        return parent;
    }

    /** Part after the separator. */
    public String getSuffix() {
        return value.substring(Keycode.LENGTH + 1);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(SubKeycode other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubKeycode)) return false;
        return value.equals(((SubKeycode) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
