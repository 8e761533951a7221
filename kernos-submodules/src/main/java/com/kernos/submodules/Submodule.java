package com.kernos.submodules;

import com.kernos.kernel.Address;
import com.kernos.kernel.Version;
import com.kernos.keycode.Keycode;
import com.kernos.keycode.SubKeycode;

import java.util.Objects;

/**
 * Pluggable extension of a {@link ModuleWithSubmodules}. Bound to its parent at construction;
 * privileged entry points take the parent's {@link ParentCapability} and start with
 * {@link #onlyParent(ParentCapability)}.
 * <p>
 * {@link #getParentKeycode()} and {@link #getSubKeycode()} are called from this constructor, so they
 * must return constants that do not depend on subclass fields.
 */
public abstract class Submodule {

    private final ModuleWithSubmodules parent;
    private final Address address;

    protected Submodule(ModuleWithSubmodules parent) {
        this.parent = Objects.requireNonNull(parent, "parent");
        Keycode declared = getParentKeycode();
        if (!parent.getKeycode().equals(declared)) {
            throw new SubmoduleInvalidParentException(declared, parent.getKeycode());
        }
        this.address = Address.create(getClass().getSimpleName());
    }

    /** Keycode of the module this submodule belongs to. */
    public abstract Keycode getParentKeycode();

    /** Sub-keycode under the parent's namespace, e.g. {@code TRSRY.ALLOCATOR}. */
    public abstract SubKeycode getSubKeycode();

    public abstract Version getVersion();

    public final ModuleWithSubmodules getParent() {
        return parent;
    }

    public final Address getAddress() {
        return address;
    }

    /** Called by the parent right after this submodule is registered. Throwing aborts the registration. */
    protected void init() {
    }

    final void initFromParent(ParentCapability caller) {
        onlyParent(caller);
        init();
    }

    /**
     * @throws SubmoduleOnlyParentException unless {@code caller} is a live token of this submodule's parent
     *                                      and this instance is the one installed under its sub-keycode
     */
    protected final void onlyParent(ParentCapability caller) {
        if (caller == null || caller.getOwner() != parent || !caller.covers(this)
                || parent.getSubmoduleForKeycode(getSubKeycode()).orElse(null) != this) {
            throw new SubmoduleOnlyParentException(getSubKeycode());
        }
    }

    @Override
    public String toString() {
        return getSubKeycode() + "@" + address;
    }
}
