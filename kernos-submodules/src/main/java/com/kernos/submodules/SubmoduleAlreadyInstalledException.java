package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.SubKeycode;

/** Thrown when registering a sub-keycode that is already installed in the parent. */
public final class SubmoduleAlreadyInstalledException extends KernelException {

    private final SubKeycode subKeycode;

    public SubmoduleAlreadyInstalledException(SubKeycode subKeycode) {
        super(ErrorCategory.IDENTITY, String.format("Submodule %s is already installed", subKeycode));
        this.subKeycode = subKeycode;
    }

    public SubKeycode getSubKeycode() {
        return subKeycode;
    }
}
