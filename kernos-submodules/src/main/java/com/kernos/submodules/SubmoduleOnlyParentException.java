package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.SubKeycode;

/** Thrown when a privileged submodule entry point is called by anything but its parent module. */
public final class SubmoduleOnlyParentException extends KernelException {

    private final SubKeycode subKeycode;

    public SubmoduleOnlyParentException(SubKeycode subKeycode) {
        super(ErrorCategory.AUTHORIZATION, String.format("Only the parent module may call submodule %s", subKeycode));
        this.subKeycode = subKeycode;
    }

    public SubKeycode getSubKeycode() {
        return subKeycode;
    }
}
