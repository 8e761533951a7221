package com.kernos.kernel;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identity of an actor: executor, kernel, module, policy or submodule.
 * Every {@link #create(String)} call yields a distinct address; the label is for logs only.
 */
public final class Address {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String label;
    private final long id;

    private Address(String label, long id) {
        this.label = label;
        this.id = id;
    }

    /**
     * Creates a new, unique address.
     *
     * @param label human-readable label (e.g. class name); blank becomes "actor"
     */
    public static Address create(String label) {
        String l = label != null && !label.isBlank() ? label.trim() : "actor";
        return new Address(l, SEQUENCE.incrementAndGet());
    }

    public String getLabel() {
        return label;
    }

    public long getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        return id == ((Address) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    /** {@code label#id}, e.g. {@code Treasury#12}. */
    @Override
    public String toString() {
        return label + "#" + id;
    }
}
