package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.Keycode;
import com.kernos.keycode.SubKeycode;

/** Thrown when a submodule is bound to, or registered with, a module other than its declared parent. */
public final class SubmoduleInvalidParentException extends KernelException {

    private final Keycode declaredParent;
    private final Keycode actualParent;

    public SubmoduleInvalidParentException(Keycode declaredParent, Keycode actualParent) {
        super(ErrorCategory.IDENTITY,
                String.format("Submodule declares parent %s but is bound to %s", declaredParent, actualParent));
        this.declaredParent = declaredParent;
        this.actualParent = actualParent;
    }

    /** The submodule is bound to a different instance of a module with the right keycode. */
    public SubmoduleInvalidParentException(SubKeycode subKeycode) {
        super(ErrorCategory.IDENTITY,
                String.format("Submodule %s is bound to another instance of module %s", subKeycode, subKeycode.getParent()));
        this.declaredParent = subKeycode.getParent();
        this.actualParent = subKeycode.getParent();
    }

    public Keycode getDeclaredParent() {
        return declaredParent;
    }

    public Keycode getActualParent() {
        return actualParent;
    }
}
