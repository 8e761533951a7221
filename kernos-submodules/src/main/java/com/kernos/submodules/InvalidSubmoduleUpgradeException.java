package com.kernos.submodules;

import com.kernos.kernel.ErrorCategory;
import com.kernos.kernel.KernelException;
import com.kernos.keycode.SubKeycode;

/** Thrown when upgrading a sub-keycode that is not installed, or to the instance already installed. */
public final class InvalidSubmoduleUpgradeException extends KernelException {

    private final SubKeycode subKeycode;

    public InvalidSubmoduleUpgradeException(SubKeycode subKeycode) {
        super(ErrorCategory.LIFECYCLE, String.format("Invalid upgrade of submodule %s", subKeycode));
        this.subKeycode = subKeycode;
    }

    public SubKeycode getSubKeycode() {
        return subKeycode;
    }
}
